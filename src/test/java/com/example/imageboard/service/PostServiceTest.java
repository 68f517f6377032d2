package com.example.imageboard.service;

import com.example.imageboard.entity.Board;
import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;
import com.example.imageboard.exception.NotFoundException;
import com.example.imageboard.exception.ThreadLockedException;
import com.example.imageboard.exception.ValidationException;
import com.example.imageboard.model.PostForm;
import com.example.imageboard.model.PostingResult;
import com.example.imageboard.model.StoredMedia;
import com.example.imageboard.model.ThreadView;
import com.example.imageboard.repository.BoardThreadRepository;
import com.example.imageboard.repository.PostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Post/thread lifecycle against the full application context. Every test
 * runs in a transaction that is rolled back afterwards.
 */
@SpringBootTest
@Transactional
class PostServiceTest {

    @Autowired
    private BoardService boardService;

    @Autowired
    private PostService postService;

    @Autowired
    private BoardThreadRepository threadRepository;

    @Autowired
    private PostRepository postRepository;

    private Board board;

    @BeforeEach
    void setUp() {
        board = boardService.createBoard("pst", "Posting", "posting tests");
    }

    // -- Thread creation --

    @Test
    void createThread_shouldCreateThreadWithFirstPost() {
        PostingResult result = postService.createThread(board.getId(), PostForm.comment("hello"));

        BoardThread thread = result.getThread();
        Post post = result.getPost();
        assertEquals("No Subject", thread.getSubject());
        assertEquals(board.getId(), thread.getBoardId());
        assertEquals(thread.getCreatedAt(), thread.getBumpedAt());
        assertFalse(thread.isPinned());
        assertFalse(thread.isLocked());

        assertEquals(1, post.getPostNumber());
        assertEquals("hello", post.getComment());
        assertEquals("Anonymous", post.getName());
        assertEquals(thread.getId(), post.getThreadId());
        assertNull(post.getFilename());
        assertNull(post.getOriginalFilename());
        assertNull(post.getFileSize());
    }

    @Test
    void createThread_shouldKeepGivenSubjectAndName() {
        PostForm form = new PostForm("  moot ", "sage", "Welcome", "", null);
        PostingResult result = postService.createThread(board.getId(), form);

        assertEquals("Welcome", result.getThread().getSubject());
        assertEquals("moot", result.getPost().getName());
        assertEquals("sage", result.getPost().getEmail());
    }

    @Test
    void createThread_shouldAcceptAttachmentOnly() {
        StoredMedia media = new StoredMedia("0123456789ab.png", "cat.png", 42);
        PostingResult result = postService.createThread(board.getId(), new PostForm(null, null, null, null, media));

        Post post = result.getPost();
        assertEquals("0123456789ab.png", post.getFilename());
        assertEquals("cat.png", post.getOriginalFilename());
        assertEquals(42L, post.getFileSize());
        assertNull(post.getImageWidth());
        assertNull(post.getThumbnail());
    }

    @Test
    void createThread_shouldRejectEmptyPostAndWriteNothing() {
        long threadsBefore = threadRepository.count();
        long postsBefore = postRepository.count();

        assertThrows(ValidationException.class,
                () -> postService.createThread(board.getId(), new PostForm("name", "mail", " ", "", null)));

        assertEquals(threadsBefore, threadRepository.count());
        assertEquals(postsBefore, postRepository.count());
    }

    @Test
    void createThread_shouldRejectOverlongFieldsAndWriteNothing() {
        long before = threadRepository.countByBoardId(board.getId());
        String subject = "s".repeat(Post.SUBJECT_MAX_LENGTH + 1);

        ValidationException e = assertThrows(ValidationException.class,
                () -> postService.createThread(board.getId(), new PostForm(null, null, subject, "hi", null)));
        assertTrue(e.getMessage().startsWith("Subject is too long"), e.getMessage());
        assertThrows(ValidationException.class, () -> postService.createThread(board.getId(),
                new PostForm("n".repeat(Post.NAME_MAX_LENGTH + 1), null, null, "hi", null)));
        assertEquals(before, threadRepository.countByBoardId(board.getId()));

        // exactly at the limit is fine
        PostingResult ok = postService.createThread(board.getId(), new PostForm(null, null, "s".repeat(Post.SUBJECT_MAX_LENGTH), "hi", null));
        assertEquals(Post.SUBJECT_MAX_LENGTH, ok.getThread().getSubject().length());
    }

    @Test
    void appendPost_shouldRejectOverlongEmail() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();

        assertThrows(ValidationException.class, () -> postService.appendPost(threadId,
                new PostForm(null, "e".repeat(Post.EMAIL_MAX_LENGTH + 1), null, "reply", null)));
        assertEquals(1, postRepository.countByThreadId(threadId));
    }

    @Test
    void createThread_shouldFailForUnknownBoard() {
        assertThrows(NotFoundException.class, () -> postService.createThread(-1L, PostForm.comment("x")));
    }

    // -- Replies --

    @Test
    void appendPost_shouldNumberPostsSequentially() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();
        assertEquals(2, postService.nextNumber(threadId));

        for (int expected = 2; expected <= 6; expected++) {
            Post reply = postService.appendPost(threadId, PostForm.comment("reply " + expected)).getPost();
            assertEquals(expected, reply.getPostNumber());
            assertEquals(expected + 1, postService.nextNumber(threadId));
        }
        assertEquals(6, postRepository.countByThreadId(threadId));
    }

    @Test
    void appendPost_shouldBumpThread() {
        BoardThread thread = postService.createThread(board.getId(), PostForm.comment("op")).getThread();
        Instant before = thread.getBumpedAt();

        postService.appendPost(thread.getId(), PostForm.comment("reply"));

        Instant after = threadRepository.findById(thread.getId()).orElseThrow().getBumpedAt();
        assertFalse(after.isBefore(before));
    }

    @Test
    void appendPost_shouldRejectLockedThreadWithoutWriting() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();
        postService.setLocked(threadId, true);

        ThreadLockedException e = assertThrows(ThreadLockedException.class,
                () -> postService.appendPost(threadId, PostForm.comment("too late")));

        assertEquals(threadId, e.getThreadId());
        assertEquals(1, postRepository.countByThreadId(threadId));
    }

    @Test
    void appendPost_shouldAcceptRepliesAgainAfterUnlock() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();
        postService.setLocked(threadId, true);
        postService.setLocked(threadId, false);

        assertEquals(2, postService.appendPost(threadId, PostForm.comment("back")).getPost().getPostNumber());
    }

    @Test
    void appendPost_shouldFailForUnknownThread() {
        assertThrows(NotFoundException.class, () -> postService.appendPost(-1L, PostForm.comment("x")));
    }

    @Test
    void appendPost_shouldRejectThreadFromAnotherBoard() {
        Board other = boardService.createBoard("oth", "Other", null);
        Long threadId = postService.createThread(other.getId(), PostForm.comment("op")).getThread().getId();

        assertThrows(NotFoundException.class,
                () -> postService.appendPost(board.getId(), threadId, PostForm.comment("wrong board")));
        assertEquals(1, postRepository.countByThreadId(threadId));
    }

    @Test
    void nextNumber_shouldStartAtOneForEmptyThread() {
        BoardThread empty = threadRepository.save(new BoardThread(board.getId(), "empty", Instant.now()));
        assertEquals(1, postService.nextNumber(empty.getId()));
    }

    // -- Thread view and flags --

    @Test
    void getThreadView_shouldListAllPostsOldestFirst() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();
        postService.appendPost(threadId, PostForm.comment("second"));
        postService.appendPost(threadId, PostForm.comment("third"));

        ThreadView view = postService.getThreadView(board, threadId);

        List<String> comments = view.getPosts().stream().map(Post::getComment).collect(Collectors.toList());
        assertEquals(List.of("op", "second", "third"), comments);
    }

    @Test
    void getThreadView_shouldNotFindThreadOfOtherBoard() {
        Board other = boardService.createBoard("oth", "Other", null);
        Long threadId = postService.createThread(other.getId(), PostForm.comment("op")).getThread().getId();

        assertThrows(NotFoundException.class, () -> postService.getThreadView(board, threadId));
    }

    @Test
    void setPinned_shouldToggleFlag() {
        Long threadId = postService.createThread(board.getId(), PostForm.comment("op")).getThread().getId();

        assertTrue(postService.setPinned(threadId, true).isPinned());
        assertFalse(postService.setPinned(threadId, false).isPinned());
        assertThrows(NotFoundException.class, () -> postService.setPinned(-1L, true));
    }
}
