package com.staydesk.booking.api.dto;

import com.staydesk.pricing.model.Quote;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record QuoteResponse(
        Long roomId,
        String roomName,
        LocalDate checkIn,
        LocalDate checkOut,
        List<NightlyPriceResponse> nights,
        List<AddOnLineResponse> addons,
        BigDecimal subtotal,
        BigDecimal baseTotal,
        BigDecimal addonsTotal,
        BigDecimal totalAmount,
        String currency,
        int nightCount
) {
    public static QuoteResponse from(Long roomId, String roomName, LocalDate checkIn, LocalDate checkOut, Quote quote) {
        return new QuoteResponse(
                roomId,
                roomName,
                checkIn,
                checkOut,
                quote.nights().stream().map(NightlyPriceResponse::from).toList(),
                quote.addOns().stream().map(AddOnLineResponse::from).toList(),
                quote.baseTotal(),
                quote.baseTotal(),
                quote.addOnTotal(),
                quote.grandTotal(),
                quote.currency(),
                quote.nightCount()
        );
    }
}
