package com.example.imageboard.exception;

/**
 * 附件写盘失败 (磁盘满、权限不足等)，按服务器错误处理。
 */
public class MediaStorageException extends ImageboardException {

    public MediaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
