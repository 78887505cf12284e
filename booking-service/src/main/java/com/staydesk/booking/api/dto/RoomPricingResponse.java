package com.staydesk.booking.api.dto;

import com.staydesk.pricing.model.Quote;

import java.math.BigDecimal;
import java.util.List;

/**
 * Nightly price breakdown of a stay: {@code {room_name, nights, subtotal, currency, night_count}}.
 */
public record RoomPricingResponse(
        Long roomId,
        String roomName,
        List<NightlyPriceResponse> nights,
        BigDecimal subtotal,
        String currency,
        int nightCount
) {
    public static RoomPricingResponse from(Long roomId, String roomName, Quote quote) {
        return new RoomPricingResponse(
                roomId,
                roomName,
                quote.nights().stream().map(NightlyPriceResponse::from).toList(),
                quote.baseTotal(),
                quote.currency(),
                quote.nightCount()
        );
    }
}
