package com.staydesk.booking.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.Set;

public record AddOnRequest(
        @NotBlank(message = "Add-on name cannot be blank")
        @Size(max = 100)
        String name,

        @Size(max = 1000)
        String description,

        @NotNull(message = "Price cannot be null")
        @DecimalMin(value = "0.00", message = "Price cannot be negative")
        BigDecimal price,

        @Pattern(regexp = "[A-Z]{3}", message = "Currency must be an ISO 4217 code")
        String currency,

        @Pattern(regexp = "per_booking|per_night|per_guest|per_guest_per_night",
                message = "Pricing type must be per_booking, per_night, per_guest or per_guest_per_night")
        String pricingType,

        @Min(value = 1, message = "Max quantity must be positive")
        Integer maxQuantity,

        Set<Long> availableForRooms,

        Boolean active
) {
}
