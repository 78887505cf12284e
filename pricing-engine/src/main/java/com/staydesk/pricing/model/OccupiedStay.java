package com.staydesk.pricing.model;

import com.staydesk.pricing.calendar.StayRange;

/**
 * An existing booking of a room, reduced to what conflict checks need.
 */
public record OccupiedStay(Long bookingId, StayRange stay, BookingStatus status) {

    public boolean blocks(StayRange requested) {
        return status.occupiesInventory() && stay.overlaps(requested);
    }
}
