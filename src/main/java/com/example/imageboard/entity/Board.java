package com.example.imageboard.entity;

import jakarta.persistence.*;

/**
 * 版块实体类 (Board)
 * 对应数据库中的 board 表。
 * 一个版块下挂着若干主题帖 (BoardThread)，通过 BoardThread.boardId 关联。
 */
@Entity
@Table(name = "board")
public class Board {

    public static final int TITLE_MAX_LENGTH = 100;

    /**
     * 主键 ID
     * 数据库自增
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 版块短名 (URL 路径段)
     * 例如: "b", "g"。全局唯一。
     */
    @Column(unique = true, nullable = false, length = 10)
    private String name;

    /**
     * 版块标题，例如 "Random"
     */
    @Column(nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    /**
     * 无参构造函数
     * JPA 规范要求必须存在
     */
    public Board() {}

    public Board(String name, String title, String description) {
        this.name = name;
        this.title = title;
        this.description = description;
    }

    // ================== Getters and Setters ==================

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
}
