package com.example.imageboard.service;

import com.example.imageboard.entity.Board;
import com.example.imageboard.exception.ConflictException;
import com.example.imageboard.exception.NotFoundException;
import com.example.imageboard.exception.ValidationException;
import com.example.imageboard.repository.BoardRepository;
import com.example.imageboard.repository.BoardThreadRepository;
import com.example.imageboard.repository.PostRepository;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 版块服务：版块的创建、删除、查询以及首次启动时的默认版块。
 */
@Service
public class BoardService {

    private static final Logger log = LoggerFactory.getLogger(BoardService.class);

    // 短名会直接出现在 URL 里，只允许字母数字、下划线和横线
    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,10}");

    // 与固定路由冲突的短名
    private static final Set<String> RESERVED_NAMES = Set.of("admin", "uploads", "css", "error");

    private static final List<Board> DEFAULT_BOARDS = List.of(
            new Board("b", "Random", "Random discussions"),
            new Board("g", "Technology", "Technology discussions"),
            new Board("v", "Video Games", "Video game discussions"));

    private final BoardRepository boardRepository;
    private final BoardThreadRepository threadRepository;
    private final PostRepository postRepository;

    public BoardService(BoardRepository boardRepository,
                        BoardThreadRepository threadRepository,
                        PostRepository postRepository) {
        this.boardRepository = boardRepository;
        this.threadRepository = threadRepository;
        this.postRepository = postRepository;
    }

    @Transactional(readOnly = true)
    public List<Board> listBoards() {
        return boardRepository.findAllByOrderByNameAsc();
    }

    /**
     * 按短名查找版块，不存在时抛 NotFoundException
     */
    @Transactional(readOnly = true)
    public Board getBoard(String name) {
        return boardRepository.findByName(name).orElseThrow(() -> NotFoundException.board(name));
    }

    /**
     * 创建版块
     *
     * @throws ValidationException 短名或标题为空、短名含非法字符、标题超长
     * @throws ConflictException   短名已存在
     */
    @Transactional
    public Board createBoard(String name, String title, String description) {
        if (!StringUtils.hasText(name) || !StringUtils.hasText(title)) {
            throw new ValidationException("Board name and title are required");
        }
        String slug = name.trim();
        if (!NAME_PATTERN.matcher(slug).matches() || RESERVED_NAMES.contains(slug.toLowerCase())) {
            throw new ValidationException("Invalid board name: " + slug);
        }
        String boardTitle = title.trim();
        if (boardTitle.length() > Board.TITLE_MAX_LENGTH) {
            throw new ValidationException("Board title is too long (max " + Board.TITLE_MAX_LENGTH + " characters)");
        }
        if (boardRepository.existsByName(slug)) {
            throw new ConflictException("Board already exists");
        }

        try {
            Board board = boardRepository.saveAndFlush(new Board(slug, boardTitle, description));
            log.info("Created board /{}/ ({})", board.getName(), board.getTitle());
            return board;
        } catch (DataIntegrityViolationException e) {
            // 并发创建同名版块时由唯一约束兜底；其他完整性错误原样抛出
            if (e.getCause() instanceof ConstraintViolationException) {
                throw new ConflictException("Board already exists");
            }
            throw e;
        }
    }

    /**
     * 删除版块
     * 显式级联：先删楼层，再删主题帖，最后删版块，全部在同一个事务里。
     */
    @Transactional
    public void deleteBoard(Long boardId) {
        Board board = boardRepository.findById(boardId)
                .orElseThrow(() -> new NotFoundException("Board not found: " + boardId));

        int posts = postRepository.deleteByBoardId(boardId);
        int threads = threadRepository.deleteByBoardId(boardId);
        boardRepository.delete(board);
        log.info("Deleted board /{}/ with {} threads and {} posts", board.getName(), threads, posts);
    }

    /**
     * 一个版块都没有时写入默认的 b / g / v 三个版块；已有版块则什么都不做。
     *
     * @return 本次新建的版块数量
     */
    @Transactional
    public int seedDefaultBoards() {
        if (boardRepository.count() > 0) {
            return 0;
        }
        for (Board template : DEFAULT_BOARDS) {
            boardRepository.save(new Board(template.getName(), template.getTitle(), template.getDescription()));
        }
        log.info("Seeded {} default boards", DEFAULT_BOARDS.size());
        return DEFAULT_BOARDS.size();
    }
}
