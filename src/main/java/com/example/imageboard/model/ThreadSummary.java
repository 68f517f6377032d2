package com.example.imageboard.model;

import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;

import java.util.List;

/**
 * 版块列表中的一条主题帖摘要 (非持久化类)
 * 包含主题帖本身、最早的几条楼层 (一定包含楼主) 以及总楼层数。
 */
public class ThreadSummary {

    private final BoardThread thread;

    // 预览楼层，按发帖时间正序
    private final List<Post> previewPosts;

    private final long totalPosts;

    public ThreadSummary(BoardThread thread, List<Post> previewPosts, long totalPosts) {
        this.thread = thread;
        this.previewPosts = previewPosts;
        this.totalPosts = totalPosts;
    }

    /**
     * 列表页 "省略了 N 条回复" 的 N
     */
    public long getOmittedPosts() {
        return Math.max(0, totalPosts - previewPosts.size());
    }

    public BoardThread getThread() { return thread; }
    public List<Post> getPreviewPosts() { return previewPosts; }
    public long getTotalPosts() { return totalPosts; }
}
