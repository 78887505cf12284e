package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record BookingResponse(
        Long id,
        String reference,
        Long roomId,
        String roomName,
        String guestName,
        String guestEmail,
        Integer guests,
        LocalDate checkIn,
        LocalDate checkOut,
        String status,
        String paymentStatus,
        String channel,
        List<AddOnLineResponse> addons,
        BigDecimal baseTotal,
        BigDecimal addonsTotal,
        BigDecimal totalAmount,
        String currency,
        Integer retryCount,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getReference(),
                booking.getRoomId(),
                booking.getRoomName(),
                booking.getGuestName(),
                booking.getGuestEmail(),
                booking.getGuests(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getStatus().code(),
                booking.getPaymentStatus().name().toLowerCase(),
                booking.getChannel().name().toLowerCase(),
                booking.getAddOns().stream().map(AddOnLineResponse::from).toList(),
                booking.roomCharge(),
                booking.getAddonsTotal(),
                booking.getTotalAmount(),
                booking.getCurrency(),
                booking.retriesSoFar(),
                booking.getCreatedAt()
        );
    }
}
