package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.SeasonalRate;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SeasonalRateResponse(
        Long id,
        Long roomId,
        String name,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal pricePerNight,
        Integer priority
) {
    public static SeasonalRateResponse from(SeasonalRate rate) {
        return new SeasonalRateResponse(
                rate.getId(),
                rate.getRoomId(),
                rate.getName(),
                rate.getStartDate(),
                rate.getEndDate(),
                rate.getPricePerNight(),
                rate.getPriority()
        );
    }
}
