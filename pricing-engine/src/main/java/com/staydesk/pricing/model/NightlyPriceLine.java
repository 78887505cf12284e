package com.staydesk.pricing.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Resolved price of one night. {@code rateName} is null when the room's base price applied.
 */
public record NightlyPriceLine(LocalDate date, BigDecimal price, String rateName) {

    public boolean isSeasonal() {
        return rateName != null;
    }
}
