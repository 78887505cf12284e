package com.staydesk.booking.domain.model;

public enum PaymentStatus {
    PENDING,
    PAID,
    PARTIAL,
    REFUNDED
}
