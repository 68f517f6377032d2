package com.example.imageboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * 站点配置 (application.properties 中 imageboard.* 开头的项)
 */
@ConfigurationProperties(prefix = "imageboard")
public class ImageboardProperties {

    /**
     * 数据库连接串，来自环境变量 DATABASE_URL。为空时使用内嵌 H2 文件库。
     */
    private String databaseUrl;

    /**
     * 附件保存目录 (扁平结构，不分子目录)
     */
    private String uploadDir = "uploads";

    /**
     * 版块列表每页主题帖数量
     */
    private int threadsPerPage = 10;

    /**
     * 版块列表里每个主题帖预览的楼层数
     */
    private int previewPosts = 5;

    private List<String> allowedExtensions = List.of("png", "jpg", "jpeg", "gif", "webp", "webm", "mp4");

    private String defaultName = "Anonymous";

    private String defaultSubject = "No Subject";

    // ================== Getters and Setters ==================

    public String getDatabaseUrl() { return databaseUrl; }
    public void setDatabaseUrl(String databaseUrl) { this.databaseUrl = databaseUrl; }

    public String getUploadDir() { return uploadDir; }
    public void setUploadDir(String uploadDir) { this.uploadDir = uploadDir; }

    public int getThreadsPerPage() { return threadsPerPage; }
    public void setThreadsPerPage(int threadsPerPage) { this.threadsPerPage = threadsPerPage; }

    public int getPreviewPosts() { return previewPosts; }
    public void setPreviewPosts(int previewPosts) { this.previewPosts = previewPosts; }

    public List<String> getAllowedExtensions() { return allowedExtensions; }
    public void setAllowedExtensions(List<String> allowedExtensions) { this.allowedExtensions = allowedExtensions; }

    public String getDefaultName() { return defaultName; }
    public void setDefaultName(String defaultName) { this.defaultName = defaultName; }

    public String getDefaultSubject() { return defaultSubject; }
    public void setDefaultSubject(String defaultSubject) { this.defaultSubject = defaultSubject; }
}
