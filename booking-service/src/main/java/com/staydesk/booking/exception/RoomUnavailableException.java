package com.staydesk.booking.exception;

import com.staydesk.common.exception.ConflictException;
import com.staydesk.pricing.model.AvailabilityVerdict;
import lombok.Getter;

/**
 * The room has no free unit for the requested nights at the time of the availability check.
 */
@Getter
public class RoomUnavailableException extends ConflictException {

    private final transient AvailabilityVerdict verdict;

    public RoomUnavailableException(String message, AvailabilityVerdict verdict) {
        super(message, "ROOM_UNAVAILABLE");
        this.verdict = verdict;
    }
}
