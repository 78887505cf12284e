package com.staydesk.booking.api.dto;

import com.staydesk.booking.domain.model.Room;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record RoomResponse(
        Long id,
        String name,
        String description,
        BigDecimal basePricePerNight,
        String currency,
        Integer totalUnits,
        Integer maxGuests,
        Integer minStayNights,
        Integer maxStayNights,
        boolean isActive,
        LocalDateTime createdAt
) {
    public static RoomResponse from(Room room) {
        return new RoomResponse(
                room.getId(),
                room.getName(),
                room.getDescription(),
                room.getBasePricePerNight(),
                room.getCurrency(),
                room.getTotalUnits(),
                room.getMaxGuests(),
                room.getMinStayNights(),
                room.getMaxStayNights(),
                room.isActive(),
                room.getCreatedAt()
        );
    }
}
