package com.staydesk.pricing.model;

import java.util.List;

/**
 * Outcome of a capacity check.
 *
 * @param peakOccupancy        highest number of units already taken on any night of the request
 * @param availableUnits       units still free on the busiest night
 * @param conflictingBookingIds bookings sharing at least one night with the request
 */
public record AvailabilityVerdict(
        boolean available,
        int totalUnits,
        int peakOccupancy,
        int availableUnits,
        List<Long> conflictingBookingIds
) {
    public AvailabilityVerdict {
        conflictingBookingIds = List.copyOf(conflictingBookingIds);
    }
}
