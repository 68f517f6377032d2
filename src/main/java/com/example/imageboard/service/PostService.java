package com.example.imageboard.service;

import com.example.imageboard.config.ImageboardProperties;
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
import com.example.imageboard.repository.BoardRepository;
import com.example.imageboard.repository.BoardThreadRepository;
import com.example.imageboard.repository.PostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 发帖服务 (Service Layer)
 * 负责主题帖和楼层的写入：开新帖、回帖、楼层号分配、顶帖、锁帖/置顶。
 * * 💡 并发处理：
 * 回帖时先对主题帖这一行加写锁 (SELECT ... FOR UPDATE)，
 * 锁帖检查、楼层号计算、插入楼层、刷新 bumpedAt 都在同一个事务、同一把锁下完成。
 * 两个并发回帖会排队执行，不会拿到相同的楼层号，也不会绕过刚加上的锁帖标记。
 * post 表上 (thread_id, post_number) 的唯一约束是最后一道防线。
 */
@Service
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private final BoardRepository boardRepository;
    private final BoardThreadRepository threadRepository;
    private final PostRepository postRepository;
    private final ImageboardProperties properties;
    private final Clock clock;

    public PostService(BoardRepository boardRepository,
                       BoardThreadRepository threadRepository,
                       PostRepository postRepository,
                       ImageboardProperties properties,
                       Clock clock) {
        this.boardRepository = boardRepository;
        this.threadRepository = threadRepository;
        this.postRepository = postRepository;
        this.properties = properties;
        this.clock = clock;
    }

    // ================== 1. 开新帖 ==================

    /**
     * 开一个新主题帖，同时写入楼主 (1 楼)
     * 主题帖和 1 楼在同一个事务里提交，读者不会看到没有楼层的主题帖。
     *
     * @throws NotFoundException   版块不存在
     * @throws ValidationException 标题、正文、附件全部为空，或名字、邮箱、标题超长
     */
    @Transactional
    public PostingResult createThread(Long boardId, PostForm form) {
        if (!boardRepository.existsById(boardId)) {
            throw new NotFoundException("Board not found: " + boardId);
        }
        if (!StringUtils.hasText(form.getSubject())
                && !StringUtils.hasText(form.getComment())
                && form.getMedia() == null) {
            throw new ValidationException("Thread must have subject, comment, or image");
        }
        checkLengths(form);

        Instant now = now();
        String subject = StringUtils.hasText(form.getSubject()) ? form.getSubject() : properties.getDefaultSubject();
        BoardThread thread = threadRepository.save(new BoardThread(boardId, subject, now));

        Post post = postRepository.save(buildPost(thread.getId(), 1, form, now));
        log.info("Created thread {} on board {}", thread.getId(), boardId);
        return new PostingResult(thread, post);
    }

    // ================== 2. 回帖 ==================

    /**
     * 向已有主题帖追加一条回复，并顶帖
     *
     * @throws NotFoundException     主题帖不存在
     * @throws ThreadLockedException 主题帖已锁
     * @throws ValidationException   名字、邮箱或标题超长
     */
    @Transactional
    public PostingResult appendPost(Long threadId, PostForm form) {
        return appendPost(null, threadId, form);
    }

    /**
     * 同上，另外要求主题帖属于指定版块 (boardId 为 null 时不检查)
     */
    @Transactional
    public PostingResult appendPost(Long boardId, Long threadId, PostForm form) {
        BoardThread thread = threadRepository.findByIdForUpdate(threadId)
                .orElseThrow(() -> NotFoundException.thread(threadId));
        if (boardId != null && !boardId.equals(thread.getBoardId())) {
            throw NotFoundException.thread(threadId);
        }
        if (thread.isLocked()) {
            throw new ThreadLockedException(threadId);
        }
        checkLengths(form);

        Instant now = now();
        int postNumber = nextNumber(threadId);
        Post post = postRepository.save(buildPost(threadId, postNumber, form, now));
        thread.bump(now);
        threadRepository.save(thread);

        log.info("Appended post #{} to thread {}", postNumber, threadId);
        return new PostingResult(thread, post);
    }

    /**
     * 下一个楼层号 = 当前最大楼层号 + 1；还没有任何楼层时为 1
     */
    @Transactional(readOnly = true)
    public int nextNumber(Long threadId) {
        Integer max = postRepository.findMaxPostNumber(threadId);
        return max == null ? 1 : max + 1;
    }

    // ================== 3. 查看主题帖 ==================

    /**
     * 主题帖详情：全部楼层按时间正序
     * 主题帖不属于该版块时同样视为不存在。楼层列表可能为空，由调用方决定如何展示。
     */
    @Transactional(readOnly = true)
    public ThreadView getThreadView(Board board, Long threadId) {
        BoardThread thread = threadRepository.findByIdAndBoardId(threadId, board.getId())
                .orElseThrow(() -> NotFoundException.thread(threadId));
        List<Post> posts = postRepository.findByThreadIdOrderByCreatedAtAscPostNumberAsc(threadId);
        return new ThreadView(board, thread, posts);
    }

    // ================== 4. 管理标记 ==================

    @Transactional
    public BoardThread setPinned(Long threadId, boolean pinned) {
        BoardThread thread = threadRepository.findByIdForUpdate(threadId)
                .orElseThrow(() -> NotFoundException.thread(threadId));
        thread.setPinned(pinned);
        log.info("Thread {} pinned={}", threadId, pinned);
        return threadRepository.save(thread);
    }

    @Transactional
    public BoardThread setLocked(Long threadId, boolean locked) {
        BoardThread thread = threadRepository.findByIdForUpdate(threadId)
                .orElseThrow(() -> NotFoundException.thread(threadId));
        thread.setLocked(locked);
        log.info("Thread {} locked={}", threadId, locked);
        return threadRepository.save(thread);
    }

    // ================== 内部方法 ==================

    private static void checkLengths(PostForm form) {
        checkLength("Name", form.getName(), Post.NAME_MAX_LENGTH);
        checkLength("Email", form.getEmail(), Post.EMAIL_MAX_LENGTH);
        checkLength("Subject", form.getSubject(), Post.SUBJECT_MAX_LENGTH);
    }

    private static void checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ValidationException(field + " is too long (max " + max + " characters)");
        }
    }

    private Post buildPost(Long threadId, int postNumber, PostForm form, Instant now) {
        Post post = new Post(threadId, postNumber, now);
        post.setName(StringUtils.hasText(form.getName()) ? form.getName().trim() : properties.getDefaultName());
        post.setEmail(form.getEmail());
        post.setSubject(form.getSubject());
        post.setComment(form.getComment());

        StoredMedia media = form.getMedia();
        if (media != null) {
            post.setFilename(media.getStoredName());
            post.setOriginalFilename(media.getOriginalFilename());
            post.setFileSize(media.getSize());
        }
        return post;
    }

    // 数据库时间戳精度到微秒，这里提前截断，保证内存对象和库里读出来的一致
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}
