package com.staydesk.common.exception;

/**
 * The request is valid but collides with current state (dates already taken, capacity exhausted).
 * Mapped to HTTP 409; callers may retry with fresh data.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
