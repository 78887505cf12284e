package com.staydesk.booking.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record ConflictCheckRequest(
        @NotNull(message = "Room ID cannot be null")
        Long roomId,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        Long excludeBookingId
) {
}
