package com.example.imageboard.exception;

/**
 * 版块短名重复
 */
public class ConflictException extends ImageboardException {

    public ConflictException(String message) {
        super(message);
    }
}
