package com.example.imageboard.exception;

/**
 * 用户输入不合法，例如新帖既没有标题、正文，也没有附件。
 */
public class ValidationException extends ImageboardException {

    public ValidationException(String message) {
        super(message);
    }
}
