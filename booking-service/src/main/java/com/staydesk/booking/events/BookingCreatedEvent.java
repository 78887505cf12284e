package com.staydesk.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Event published when a booking is committed.
 * Consumed by notification delivery (confirmation e-mail) and reporting.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCreatedEvent {
    private Long bookingId;
    private String reference;
    private UUID tenantId;
    private Long roomId;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private Integer guests;
    private BigDecimal baseTotal;
    private BigDecimal addonsTotal;
    private BigDecimal totalAmount;
    private String currency;
    private String status;
    private String channel;
    private Instant timestamp;
}
