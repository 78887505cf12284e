package com.staydesk.pricing.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/**
 * The slice of a room the engine prices against.
 *
 * @param basePricePerNight price of any night no seasonal rate covers
 * @param currency          currency of every amount derived for this room
 * @param totalUnits        interchangeable units; 1 for a single room
 */
public record PricedRoom(
        Long id,
        UUID tenantId,
        String name,
        BigDecimal basePricePerNight,
        String currency,
        int totalUnits,
        boolean active
) {
    public PricedRoom {
        Objects.requireNonNull(basePricePerNight, "basePricePerNight");
        Objects.requireNonNull(currency, "currency");
        if (totalUnits < 1) {
            throw new IllegalArgumentException("totalUnits must be at least 1, was " + totalUnits);
        }
    }
}
