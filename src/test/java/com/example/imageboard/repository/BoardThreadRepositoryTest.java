package com.example.imageboard.repository;

import com.example.imageboard.entity.Board;
import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Query-level tests for the thread listing order and the explicit
 * board cascade, run against an embedded database.
 */
@DataJpaTest
class BoardThreadRepositoryTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    @Autowired
    private BoardRepository boardRepository;

    @Autowired
    private BoardThreadRepository threadRepository;

    @Autowired
    private PostRepository postRepository;

    private Board board;

    @BeforeEach
    void setUp() {
        board = boardRepository.save(new Board("t", "Test", "Test board"));
    }

    @Test
    void findListing_shouldPutPinnedFirstThenMostRecentlyBumped() {
        thread("old", 10, false);
        thread("newest", 300, false);
        thread("pinnedOld", 1, true);
        thread("middle", 200, false);
        thread("pinnedNew", 100, true);

        Page<BoardThread> page = threadRepository.findListing(board.getId(), PageRequest.of(0, 10));

        assertEquals(List.of("pinnedNew", "pinnedOld", "newest", "middle", "old"), subjects(page.getContent()));
        assertEquals(5, page.getTotalElements());
        assertFalse(page.hasNext());
    }

    @Test
    void findListing_shouldOnlyReturnThreadsOfTheBoard() {
        Board other = boardRepository.save(new Board("o", "Other", null));
        thread("mine", 1, false);
        threadRepository.save(new BoardThread(other.getId(), "theirs", BASE));

        Page<BoardThread> page = threadRepository.findListing(board.getId(), PageRequest.of(0, 10));
        assertEquals(List.of("mine"), subjects(page.getContent()));
    }

    @Test
    void findListing_shouldPaginateByOffset() {
        for (int i = 0; i < 12; i++) {
            thread("t" + i, i, false);
        }

        Page<BoardThread> first = threadRepository.findListing(board.getId(), PageRequest.of(0, 10));
        Page<BoardThread> second = threadRepository.findListing(board.getId(), PageRequest.of(1, 10));
        Page<BoardThread> beyond = threadRepository.findListing(board.getId(), PageRequest.of(5, 10));

        assertEquals(10, first.getNumberOfElements());
        assertTrue(first.hasNext());
        assertEquals(List.of("t1", "t0"), subjects(second.getContent()));
        assertFalse(second.hasNext());
        assertTrue(beyond.getContent().isEmpty());
    }

    @Test
    void findByIdAndBoardId_shouldNotCrossBoards() {
        Board other = boardRepository.save(new Board("o", "Other", null));
        BoardThread thread = thread("x", 0, false);

        assertTrue(threadRepository.findByIdAndBoardId(thread.getId(), board.getId()).isPresent());
        assertTrue(threadRepository.findByIdAndBoardId(thread.getId(), other.getId()).isEmpty());
    }

    @Test
    void deleteByBoardId_shouldRemoveThreadsAndPosts() {
        BoardThread thread = thread("doomed", 0, false);
        postRepository.save(new Post(thread.getId(), 1, BASE));
        postRepository.save(new Post(thread.getId(), 2, BASE.plusSeconds(1)));

        assertEquals(2, postRepository.deleteByBoardId(board.getId()));
        assertEquals(1, threadRepository.deleteByBoardId(board.getId()));
        assertEquals(0, threadRepository.countByBoardId(board.getId()));
        assertEquals(0, postRepository.countByThreadId(thread.getId()));
    }

    private BoardThread thread(String subject, long bumpOffsetSeconds, boolean pinned) {
        BoardThread thread = new BoardThread(board.getId(), subject, BASE);
        thread.setBumpedAt(BASE.plusSeconds(bumpOffsetSeconds));
        thread.setPinned(pinned);
        return threadRepository.save(thread);
    }

    private static List<String> subjects(List<BoardThread> threads) {
        return threads.stream().map(BoardThread::getSubject).collect(Collectors.toList());
    }
}
