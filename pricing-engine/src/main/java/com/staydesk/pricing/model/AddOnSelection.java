package com.staydesk.pricing.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An add-on the guest picked, with the unit price in force when it was picked.
 */
public record AddOnSelection(
        Long id,
        String name,
        BigDecimal unitPrice,
        int quantity,
        AddOnPricingType pricingType
) {
    public AddOnSelection {
        Objects.requireNonNull(unitPrice, "unitPrice");
        if (quantity < 1) {
            throw new IllegalArgumentException("Add-on quantity must be positive, was " + quantity);
        }
        if (pricingType == null) {
            pricingType = AddOnPricingType.PER_BOOKING;
        }
    }

    public static AddOnSelection perBooking(Long id, String name, BigDecimal unitPrice, int quantity) {
        return new AddOnSelection(id, name, unitPrice, quantity, AddOnPricingType.PER_BOOKING);
    }
}
