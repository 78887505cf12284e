package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.AddOnLine;
import com.staydesk.pricing.model.AddOnPricingType;
import com.staydesk.pricing.model.AddOnSelection;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Add-on line frozen on a booking with the unit price charged at the time.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class BookingAddOnItem {

    @Column(name = "addon_id", nullable = false)
    private Long addOnId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Convert(converter = AddOnPricingTypeConverter.class)
    @Column(name = "pricing_type", nullable = false, length = 30)
    private AddOnPricingType pricingType;

    @Column(name = "total", nullable = false, precision = 12, scale = 2)
    private BigDecimal total;

    public static BookingAddOnItem from(AddOnLine line) {
        return new BookingAddOnItem(line.id(), line.name(), line.unitPrice(), line.quantity(),
                line.pricingType(), line.total());
    }

    public AddOnSelection toSelection() {
        return new AddOnSelection(addOnId, name, unitPrice, quantity, pricingType);
    }
}
