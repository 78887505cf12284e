package com.staydesk.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AddOnSelectionRequest(
        @NotNull(message = "Add-on ID cannot be null")
        Long addonId,

        @NotNull(message = "Quantity cannot be null")
        @Positive(message = "Quantity must be positive")
        Integer quantity
) {
}
