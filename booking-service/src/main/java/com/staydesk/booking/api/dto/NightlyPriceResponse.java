package com.staydesk.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.staydesk.pricing.model.NightlyPriceLine;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One priced night. {@code rate_name} is always written, as null for nights at the base price.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record NightlyPriceResponse(LocalDate date, BigDecimal price, String rateName) {

    public static NightlyPriceResponse from(NightlyPriceLine line) {
        return new NightlyPriceResponse(line.date(), line.price(), line.rateName());
    }
}
