package com.example.imageboard.model;

/**
 * 附件保存结果
 */
public class StoredMedia {

    // 系统生成的文件名，例如 "9c1e04ab57d2.png"
    private final String storedName;

    // 安全处理后的原始文件名，仅用于页面展示
    private final String originalFilename;

    private final long size;

    public StoredMedia(String storedName, String originalFilename, long size) {
        this.storedName = storedName;
        this.originalFilename = originalFilename;
        this.size = size;
    }

    public String getStoredName() { return storedName; }
    public String getOriginalFilename() { return originalFilename; }
    public long getSize() { return size; }
}
