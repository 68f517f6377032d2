package com.example.imageboard.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * 主题帖实体类 (BoardThread)
 * 对应数据库中的 thread 表。
 * * 类名没有直接叫 Thread，是为了避免和 java.lang.Thread 撞名。
 * * 排序规则：置顶 (pinned) 的帖子永远排在前面，其余按 bumpedAt 倒序。
 */
@Entity
@Table(name = "thread", indexes = {
        @Index(name = "idx_thread_board_order", columnList = "board_id, is_pinned, bumped_at")
})
public class BoardThread {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 所属版块 ID
     * 创建后不可修改 (updatable = false)。
     */
    @Column(name = "board_id", nullable = false, updatable = false)
    private Long boardId;

    @Column(length = Post.SUBJECT_MAX_LENGTH)
    private String subject;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * 最后一次被顶起的时间
     * 每次成功回帖都会刷新，版块列表按它倒序排列。
     */
    @Column(name = "bumped_at", nullable = false)
    private Instant bumpedAt;

    /**
     * 置顶标记
     */
    @Column(name = "is_pinned", nullable = false)
    private boolean pinned = false;

    /**
     * 锁帖标记：为 true 时拒绝一切新回复
     */
    @Column(name = "is_locked", nullable = false)
    private boolean locked = false;

    public BoardThread() {}

    /**
     * 新建主题帖时使用
     * createdAt 与 bumpedAt 初始化为同一时刻，首帖不需要再单独顶一次。
     */
    public BoardThread(Long boardId, String subject, Instant now) {
        this.boardId = boardId;
        this.subject = subject;
        this.createdAt = now;
        this.bumpedAt = now;
    }

    /**
     * 顶帖。时间只进不退。
     */
    public void bump(Instant now) {
        if (bumpedAt == null || now.isAfter(bumpedAt)) {
            this.bumpedAt = now;
        }
    }

    // ================== Getters and Setters ==================

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getBoardId() { return boardId; }
    public void setBoardId(Long boardId) { this.boardId = boardId; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getBumpedAt() { return bumpedAt; }
    public void setBumpedAt(Instant bumpedAt) { this.bumpedAt = bumpedAt; }

    public boolean isPinned() { return pinned; }
    public void setPinned(boolean pinned) { this.pinned = pinned; }

    public boolean isLocked() { return locked; }
    public void setLocked(boolean locked) { this.locked = locked; }
}
