package com.example.imageboard.model;

import com.example.imageboard.entity.Board;
import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.entity.Post;

import java.util.List;

/**
 * 主题帖详情页的数据载体：版块 + 主题帖 + 全部楼层
 */
public class ThreadView {

    private final Board board;
    private final BoardThread thread;
    private final List<Post> posts;

    public ThreadView(Board board, BoardThread thread, List<Post> posts) {
        this.board = board;
        this.thread = thread;
        this.posts = posts;
    }

    public Board getBoard() { return board; }
    public BoardThread getThread() { return thread; }
    public List<Post> getPosts() { return posts; }
}
