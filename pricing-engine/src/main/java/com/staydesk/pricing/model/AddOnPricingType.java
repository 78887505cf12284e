package com.staydesk.pricing.model;

import java.util.Arrays;

/**
 * How an add-on's unit price scales with the stay.
 */
public enum AddOnPricingType {
    PER_BOOKING("per_booking"),
    PER_NIGHT("per_night"),
    PER_GUEST("per_guest"),
    PER_GUEST_PER_NIGHT("per_guest_per_night");

    private final String code;

    AddOnPricingType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public long multiplier(int nights, int guests) {
        return switch (this) {
            case PER_BOOKING -> 1;
            case PER_NIGHT -> nights;
            case PER_GUEST -> guests;
            case PER_GUEST_PER_NIGHT -> (long) guests * nights;
        };
    }

    /**
     * Unknown or missing codes price per booking.
     */
    public static AddOnPricingType fromCode(String code) {
        if (code == null) {
            return PER_BOOKING;
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code))
                .findFirst()
                .orElse(PER_BOOKING);
    }
}
