package com.staydesk.booking.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SeasonalRateRequest(
        @NotBlank(message = "Rate name cannot be blank")
        @Size(max = 100)
        String name,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        @NotNull(message = "End date cannot be null")
        LocalDate endDate,

        @NotNull(message = "Price per night cannot be null")
        @DecimalMin(value = "0.00", message = "Price per night cannot be negative")
        BigDecimal pricePerNight,

        Integer priority
) {
}
