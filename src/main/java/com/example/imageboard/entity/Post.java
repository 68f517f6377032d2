package com.example.imageboard.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * 帖子实体类 (Post)
 * 对应数据库中的 post 表，一条记录就是一次发言。
 * 每个主题帖的第一条 Post 就是楼主 (OP)，postNumber 固定为 1。
 * 帖子创建后不再修改。
 */
@Entity
@Table(name = "post",
        uniqueConstraints = @UniqueConstraint(name = "uk_post_thread_number", columnNames = {"thread_id", "post_number"}),
        indexes = @Index(name = "idx_post_thread_created", columnList = "thread_id, created_at"))
public class Post {

    // 文本字段的列宽，超出时由 PostService 拒绝
    public static final int NAME_MAX_LENGTH = 100;
    public static final int EMAIL_MAX_LENGTH = 100;
    public static final int SUBJECT_MAX_LENGTH = 200;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * 所属主题帖 ID (不可修改)
     */
    @Column(name = "thread_id", nullable = false, updatable = false)
    private Long threadId;

    /**
     * 楼层号
     * 同一主题帖内从 1 开始连续递增。(threadId, postNumber) 有唯一约束。
     */
    @Column(name = "post_number", nullable = false, updatable = false)
    private Integer postNumber;

    @Column(length = NAME_MAX_LENGTH)
    private String name;

    @Column(length = EMAIL_MAX_LENGTH)
    private String email;

    @Column(length = SUBJECT_MAX_LENGTH)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String comment;

    // ================== 附件信息 (无附件时全部为 null) ==================

    /**
     * 系统生成的存储文件名，例如 "3f9a1c0b2d4e.png"
     */
    @Column(length = 255)
    private String filename;

    /**
     * 用户上传时的原始文件名 (已做安全处理，仅用于展示)
     */
    @Column(length = 255)
    private String originalFilename;

    private Long fileSize;

    // 以下三个字段预留，当前不生成缩略图也不解析尺寸
    private Integer imageWidth;
    private Integer imageHeight;
    @Column(length = 255)
    private String thumbnail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Post() {}

    public Post(Long threadId, Integer postNumber, Instant createdAt) {
        this.threadId = threadId;
        this.postNumber = postNumber;
        this.createdAt = createdAt;
    }

    public boolean hasAttachment() {
        return filename != null;
    }

    // ================== Getters and Setters ==================

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getThreadId() { return threadId; }
    public void setThreadId(Long threadId) { this.threadId = threadId; }

    public Integer getPostNumber() { return postNumber; }
    public void setPostNumber(Integer postNumber) { this.postNumber = postNumber; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }

    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }

    public String getOriginalFilename() { return originalFilename; }
    public void setOriginalFilename(String originalFilename) { this.originalFilename = originalFilename; }

    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }

    public Integer getImageWidth() { return imageWidth; }
    public void setImageWidth(Integer imageWidth) { this.imageWidth = imageWidth; }

    public Integer getImageHeight() { return imageHeight; }
    public void setImageHeight(Integer imageHeight) { this.imageHeight = imageHeight; }

    public String getThumbnail() { return thumbnail; }
    public void setThumbnail(String thumbnail) { this.thumbnail = thumbnail; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
