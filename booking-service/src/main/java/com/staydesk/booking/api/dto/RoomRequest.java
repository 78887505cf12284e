package com.staydesk.booking.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record RoomRequest(
        @NotBlank(message = "Room name cannot be blank")
        @Size(max = 150)
        String name,

        @Size(max = 2000)
        String description,

        @NotNull(message = "Base price cannot be null")
        @DecimalMin(value = "0.00", message = "Base price cannot be negative")
        BigDecimal basePricePerNight,

        @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
        String currency,

        @Min(value = 1, message = "A room has at least one unit")
        Integer totalUnits,

        @NotNull(message = "Max guests cannot be null")
        @Min(value = 1, message = "Max guests must be positive")
        Integer maxGuests,

        @Min(value = 1, message = "Minimum stay is at least one night")
        Integer minStayNights,

        @Min(value = 1, message = "Maximum stay is at least one night")
        Integer maxStayNights,

        Boolean active
) {
}
