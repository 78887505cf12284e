package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.AddOn;

import java.math.BigDecimal;
import java.util.Set;
import java.util.TreeSet;

public record AddOnResponse(
        Long id,
        String name,
        String description,
        BigDecimal price,
        String currency,
        String pricingType,
        Integer maxQuantity,
        Set<Long> availableForRooms,
        boolean isActive
) {
    public static AddOnResponse from(AddOn addOn) {
        return new AddOnResponse(
                addOn.getId(),
                addOn.getName(),
                addOn.getDescription(),
                addOn.getPrice(),
                addOn.getCurrency(),
                addOn.getPricingType().code(),
                addOn.getMaxQuantity(),
                new TreeSet<>(addOn.getAvailableForRooms()),
                addOn.isActive()
        );
    }
}
