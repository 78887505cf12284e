package com.staydesk.pricing.model;

import java.math.BigDecimal;

/**
 * Priced add-on line of a quote.
 */
public record AddOnLine(
        Long id,
        String name,
        BigDecimal unitPrice,
        int quantity,
        AddOnPricingType pricingType,
        BigDecimal total
) {
}
