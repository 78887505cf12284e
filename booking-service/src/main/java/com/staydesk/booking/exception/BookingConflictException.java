package com.staydesk.booking.exception;

import com.staydesk.common.exception.ConflictException;

/**
 * Another booking took the last unit of a night between the availability check and the commit.
 * Callers should re-check availability and retry.
 */
public class BookingConflictException extends ConflictException {

    public static final String ERROR_CODE = "CONFLICT_AT_COMMIT";

    public BookingConflictException(String message) {
        super(message, ERROR_CODE);
    }

    public BookingConflictException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
