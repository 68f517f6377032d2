package com.example.imageboard.exception;

public class ThreadLockedException extends ImageboardException {

    private final Long threadId;

    public ThreadLockedException(Long threadId) {
        super("Thread is locked");
        this.threadId = threadId;
    }

    public Long getThreadId() { return threadId; }
}
