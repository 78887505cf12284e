package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.BookingStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores booking statuses as their lowercase codes ({@code checked_in}, {@code cart_abandoned}).
 */
@Converter
public class BookingStatusConverter implements AttributeConverter<BookingStatus, String> {

    @Override
    public String convertToDatabaseColumn(BookingStatus attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public BookingStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : BookingStatus.fromCode(dbData);
    }
}
