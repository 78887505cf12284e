package com.staydesk.pricing.model;

import com.staydesk.pricing.calendar.DateWindow;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A seasonal rate as seen by the engine. {@code createdAt} may be null for rates not yet persisted.
 */
public record RateOverride(
        Long id,
        String name,
        DateWindow window,
        BigDecimal pricePerNight,
        int priority,
        Instant createdAt
) {
    public RateOverride {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(pricePerNight, "pricePerNight");
    }

    public boolean covers(LocalDate night) {
        return window.contains(night);
    }
}
