package com.staydesk.pricing.engine;

import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.AvailabilityVerdict;
import com.staydesk.pricing.model.OccupiedStay;
import com.staydesk.pricing.model.PricedRoom;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a room still has a free unit for every night of a requested stay.
 *
 * Occupancy is counted per night, so two bookings that overlap the request but not each
 * other take one unit, not two. A room is available while the busiest night stays below
 * {@code totalUnits}; for a single-unit room that reduces to "no overlapping booking".
 */
@Slf4j
public class AvailabilityChecker {

    public boolean isAvailable(PricedRoom room, Collection<OccupiedStay> existing,
                               StayRange requested, Long excludingBookingId) {
        return check(room, existing, requested, excludingBookingId).available();
    }

    public AvailabilityVerdict check(PricedRoom room, Collection<OccupiedStay> existing,
                                     StayRange requested, Long excludingBookingId) {
        List<OccupiedStay> competing = existing.stream()
                .filter(stay -> excludingBookingId == null || !excludingBookingId.equals(stay.bookingId()))
                .filter(stay -> stay.blocks(requested))
                .toList();

        int peak = 0;
        for (LocalDate night : requested.nights()) {
            int taken = (int) competing.stream()
                    .filter(stay -> stay.stay().containsNight(night))
                    .count();
            peak = Math.max(peak, taken);
        }

        int totalUnits = room.totalUnits();
        boolean available = peak < totalUnits;
        List<Long> conflicting = competing.stream()
                .map(OccupiedStay::bookingId)
                .filter(Objects::nonNull)
                .toList();
        if (!available) {
            log.debug("Room {} full for {}: peak {} of {} unit(s), conflicts {}",
                    room.id(), requested, peak, totalUnits, conflicting);
        }
        return new AvailabilityVerdict(available, totalUnits, peak, Math.max(totalUnits - peak, 0), conflicting);
    }
}
