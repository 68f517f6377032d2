package com.example.imageboard.service;

import com.example.imageboard.config.ImageboardProperties;
import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;
import com.example.imageboard.model.ThreadPage;
import com.example.imageboard.model.ThreadSummary;
import com.example.imageboard.repository.BoardThreadRepository;
import com.example.imageboard.repository.PostRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 版块列表服务 (只读)
 * * 排序：置顶帖全部排在前面，同组内按 bumpedAt 倒序。
 * * 分页：页码从 1 开始，第 p 页取 [(p-1)*size, p*size)；超出范围返回空列表。
 * * 每个主题帖附带最早的几条楼层 (默认 5 条) 和总楼层数。
 */
@Service
public class ThreadListingService {

    private final BoardThreadRepository threadRepository;
    private final PostRepository postRepository;
    private final ImageboardProperties properties;

    public ThreadListingService(BoardThreadRepository threadRepository,
                                PostRepository postRepository,
                                ImageboardProperties properties) {
        this.threadRepository = threadRepository;
        this.postRepository = postRepository;
        this.properties = properties;
    }

    public ThreadPage listThreads(Long boardId, int page) {
        return listThreads(boardId, page, properties.getThreadsPerPage());
    }

    @Transactional(readOnly = true)
    public ThreadPage listThreads(Long boardId, int page, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        // 页码小于 1 时按第 1 页处理
        int current = Math.max(page, 1);
        if ((long) (current - 1) * pageSize > Integer.MAX_VALUE) {
            return new ThreadPage(List.of(), current, false);
        }
        Page<BoardThread> threads = threadRepository.findListing(boardId, PageRequest.of(current - 1, pageSize));

        PageRequest preview = PageRequest.of(0, properties.getPreviewPosts());
        List<ThreadSummary> items = new ArrayList<>();
        for (BoardThread thread : threads.getContent()) {
            List<Post> previewPosts = postRepository.findEarliest(thread.getId(), preview);
            long total = postRepository.countByThreadId(thread.getId());
            items.add(new ThreadSummary(thread, previewPosts, total));
        }
        return new ThreadPage(items, current, threads.hasNext());
    }
}
