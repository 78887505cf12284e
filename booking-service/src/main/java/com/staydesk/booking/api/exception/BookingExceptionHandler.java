package com.staydesk.booking.api.exception;

import com.staydesk.booking.exception.BookingConflictException;
import com.staydesk.booking.exception.RoomUnavailableException;
import com.staydesk.common.dto.BaseResponse;
import com.staydesk.pricing.calendar.InvalidStayException;
import com.staydesk.pricing.model.AvailabilityVerdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Booking-specific mappings; anything not handled here falls through to the shared handler.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    static final String DATA_INTEGRITY_VIOLATION = "DATA_INTEGRITY_VIOLATION";

    @ExceptionHandler(InvalidStayException.class)
    public ResponseEntity<BaseResponse<?>> handleInvalidStay(InvalidStayException ex) {
        log.warn("Invalid date range: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(BaseResponse.error(ex.getMessage(), "INVALID_DATE_RANGE"));
    }

    @ExceptionHandler(RoomUnavailableException.class)
    public ResponseEntity<BaseResponse<AvailabilityVerdict>> handleRoomUnavailable(RoomUnavailableException ex) {
        log.info("Room unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.rejected(ex.getMessage(), ex.getErrorCode(), ex.getVerdict()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleCommitConflict(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification at commit: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error("The room was taken by a concurrent booking, please check availability again",
                        BookingConflictException.ERROR_CODE));
    }

    /**
     * Unique or check constraint rejected the write, typically two requests racing with the same
     * Idempotency-Key. Retrying with that key replays the booking that won.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<BaseResponse<?>> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error("The request conflicts with data written by another request; "
                        + "retry it, reusing the same Idempotency-Key if one was sent", DATA_INTEGRITY_VIOLATION));
    }
}
