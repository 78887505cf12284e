package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.AddOnPricingType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AddOnPricingTypeConverter implements AttributeConverter<AddOnPricingType, String> {

    @Override
    public String convertToDatabaseColumn(AddOnPricingType attribute) {
        return attribute == null ? null : attribute.code();
    }

    @Override
    public AddOnPricingType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : AddOnPricingType.fromCode(dbData);
    }
}
