package com.taskpool.exception;

/**
 * Exception thrown when a task is submitted to a pool that has begun shutting down.
 * Submitting after shutdown is a programming error; the task is never queued.
 */
public class TaskRejectedException extends PoolException {

    public TaskRejectedException(String message) {
        super(message);
    }

    public TaskRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
