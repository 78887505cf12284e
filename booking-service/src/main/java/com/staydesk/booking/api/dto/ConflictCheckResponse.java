package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.Booking;

import java.time.LocalDate;
import java.util.List;

public record ConflictCheckResponse(
        boolean hasConflicts,
        boolean available,
        int totalUnits,
        int availableUnits,
        List<ConflictingBooking> conflicts
) {
    public record ConflictingBooking(
            Long id,
            String reference,
            String guestName,
            LocalDate checkIn,
            LocalDate checkOut,
            String status
    ) {
        public static ConflictingBooking from(Booking booking) {
            return new ConflictingBooking(booking.getId(), booking.getReference(), booking.getGuestName(),
                    booking.getCheckInDate(), booking.getCheckOutDate(), booking.getStatus().code());
        }
    }
}
