package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.BookingAddOnItem;
import com.staydesk.pricing.model.AddOnLine;

import java.math.BigDecimal;

public record AddOnLineResponse(
        Long addonId,
        String name,
        BigDecimal unitPrice,
        int quantity,
        String pricingType,
        BigDecimal total
) {
    public static AddOnLineResponse from(AddOnLine line) {
        return new AddOnLineResponse(line.id(), line.name(), line.unitPrice(), line.quantity(),
                line.pricingType().code(), line.total());
    }

    public static AddOnLineResponse from(BookingAddOnItem item) {
        return new AddOnLineResponse(item.getAddOnId(), item.getName(), item.getUnitPrice(), item.getQuantity(),
                item.getPricingType().code(), item.getTotal());
    }
}
