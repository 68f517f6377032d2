package com.example.imageboard.model;

/**
 * 发帖表单字段 (不含附件本身，附件由 MediaStore 先落盘)
 */
public class PostForm {

    private String name;
    private String email;
    private String subject;
    private String comment;

    // 已保存的附件，没有附件时为 null
    private StoredMedia media;

    public PostForm() {}

    public PostForm(String name, String email, String subject, String comment, StoredMedia media) {
        this.name = name;
        this.email = email;
        this.subject = subject;
        this.comment = comment;
        this.media = media;
    }

    public static PostForm comment(String comment) {
        return new PostForm(null, null, null, comment, null);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getSubject() { return subject; }
    public void setSubject(String subject) { this.subject = subject; }

    public String getComment() { return comment; }
    public void setComment(String comment) { this.comment = comment; }

    public StoredMedia getMedia() { return media; }
    public void setMedia(StoredMedia media) { this.media = media; }
}
