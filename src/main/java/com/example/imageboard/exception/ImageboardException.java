package com.example.imageboard.exception;

/**
 * 业务异常基类
 * Controller 层统一捕获，转换为提示信息或错误页面。
 */
public class ImageboardException extends RuntimeException {

    public ImageboardException(String message) {
        super(message);
    }

    public ImageboardException(String message, Throwable cause) {
        super(message, cause);
    }
}
