package com.staydesk.pricing.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of pricing one stay: the nightly breakdown, add-on breakdown and totals.
 * {@code grandTotal} is always {@code baseTotal + addOnTotal}.
 */
public record Quote(
        List<NightlyPriceLine> nights,
        List<AddOnLine> addOns,
        BigDecimal baseTotal,
        BigDecimal addOnTotal,
        BigDecimal grandTotal,
        String currency,
        int nightCount
) {
    public Quote {
        nights = List.copyOf(nights);
        addOns = List.copyOf(addOns);
    }
}
