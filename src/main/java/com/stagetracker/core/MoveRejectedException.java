package com.stagetracker.core;

/**
 * Thrown when a move request cannot be enqueued
 */
public class MoveRejectedException extends RuntimeException {

    public MoveRejectedException(String message) {
        super(message);
    }

    public MoveRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
