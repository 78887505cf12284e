package com.staydesk.booking.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.List;

public record QuoteRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        @Positive(message = "Guests must be positive")
        Integer guests,

        List<@Valid AddOnSelectionRequest> addons
) {
}
