package com.staydesk.booking.api.dto;

import java.time.LocalDate;

public record AvailabilityResponse(
        Long roomId,
        LocalDate checkIn,
        LocalDate checkOut,
        boolean available,
        int nights,
        int totalUnits,
        int bookedUnits,
        int availableUnits,
        Integer minStayNights,
        Integer maxStayNights,
        boolean meetsMinStay,
        boolean meetsMaxStay
) {
}
