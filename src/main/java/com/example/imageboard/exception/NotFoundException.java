package com.example.imageboard.exception;

/**
 * 版块或主题帖不存在
 */
public class NotFoundException extends ImageboardException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException board(String name) {
        return new NotFoundException("Board not found: /" + name + "/");
    }

    public static NotFoundException thread(Long id) {
        return new NotFoundException("Thread not found: " + id);
    }
}
