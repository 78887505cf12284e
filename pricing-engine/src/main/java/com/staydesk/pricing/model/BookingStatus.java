package com.staydesk.pricing.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a booking. Only {@link #PENDING}, {@link #CONFIRMED} and {@link #CHECKED_IN}
 * hold a unit of the room; every other status leaves the nights free.
 */
public enum BookingStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    CHECKED_IN("checked_in"),
    CHECKED_OUT("checked_out"),
    CANCELLED("cancelled"),
    COMPLETED("completed"),
    PAYMENT_FAILED("payment_failed"),
    CART_ABANDONED("cart_abandoned");

    public static final Set<BookingStatus> OCCUPYING = EnumSet.of(PENDING, CONFIRMED, CHECKED_IN);
    public static final Set<BookingStatus> FAILED = EnumSet.of(PAYMENT_FAILED, CART_ABANDONED);

    private final String code;

    BookingStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean occupiesInventory() {
        return OCCUPYING.contains(this);
    }

    public boolean isFailure() {
        return FAILED.contains(this);
    }

    public static BookingStatus fromCode(String code) {
        return Arrays.stream(values())
                .filter(status -> status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking status: " + code));
    }
}
