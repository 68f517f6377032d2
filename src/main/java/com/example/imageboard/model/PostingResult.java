package com.example.imageboard.model;

import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;

/**
 * 发帖结果：帖子所在的主题帖 + 刚写入的楼层
 */
public class PostingResult {

    private final BoardThread thread;
    private final Post post;

    public PostingResult(BoardThread thread, Post post) {
        this.thread = thread;
        this.post = post;
    }

    public BoardThread getThread() { return thread; }
    public Post getPost() { return post; }
}
