package com.staydesk.common.exception;

import lombok.Getter;

/**
 * Raised when a request breaks a business rule (stay length, guest count, lifecycle).
 * Mapped to HTTP 400 unless a subclass says otherwise.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        this(message, "BUSINESS_ERROR");
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
