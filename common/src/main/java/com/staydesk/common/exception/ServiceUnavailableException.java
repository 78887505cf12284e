package com.staydesk.common.exception;

/**
 * Thrown when a store the request depends on (rates, idempotency records) cannot be read.
 * Client should retry later. Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
