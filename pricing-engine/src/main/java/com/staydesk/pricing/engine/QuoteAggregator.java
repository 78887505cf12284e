package com.staydesk.pricing.engine;

import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.AddOnLine;
import com.staydesk.pricing.model.AddOnSelection;
import com.staydesk.pricing.model.NightlyPriceLine;
import com.staydesk.pricing.model.PricedRoom;
import com.staydesk.pricing.model.Quote;
import com.staydesk.pricing.model.RateOverride;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Folds the nightly breakdown and the selected add-ons into a {@link Quote}.
 * The currency always comes from the room.
 */
@RequiredArgsConstructor
public class QuoteAggregator {

    private final RateResolver rateResolver;

    public Quote buildQuote(PricedRoom room, StayRange stay, Collection<RateOverride> seasonalRates,
                            Collection<AddOnSelection> addOns, int guests) {
        List<NightlyPriceLine> nights = rateResolver.resolve(room, seasonalRates, stay);
        BigDecimal baseTotal = nights.stream()
                .map(NightlyPriceLine::price)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return assemble(nights, baseTotal, room.currency(), stay.nightCount(), guests, addOns);
    }

    /**
     * Re-prices add-ons on top of a room charge fixed earlier (an existing booking's stored base total).
     * The returned quote has no nightly lines.
     */
    public Quote repriceAddOns(BigDecimal frozenBaseTotal, String currency, int nightCount, int guests,
                               Collection<AddOnSelection> addOns) {
        return assemble(List.of(), frozenBaseTotal, currency, nightCount, guests, addOns);
    }

    public AddOnLine priceAddOn(AddOnSelection selection, int nightCount, int guests) {
        long multiplier = selection.pricingType().multiplier(nightCount, Math.max(guests, 1));
        BigDecimal total = selection.unitPrice()
                .multiply(BigDecimal.valueOf(selection.quantity()))
                .multiply(BigDecimal.valueOf(multiplier));
        return new AddOnLine(selection.id(), selection.name(), selection.unitPrice(),
                selection.quantity(), selection.pricingType(), total);
    }

    private Quote assemble(List<NightlyPriceLine> nights, BigDecimal baseTotal, String currency,
                           int nightCount, int guests, Collection<AddOnSelection> addOns) {
        List<AddOnLine> addOnLines = new ArrayList<>();
        BigDecimal addOnTotal = BigDecimal.ZERO;
        if (addOns != null) {
            for (AddOnSelection selection : addOns) {
                AddOnLine line = priceAddOn(selection, nightCount, guests);
                addOnLines.add(line);
                addOnTotal = addOnTotal.add(line.total());
            }
        }
        return new Quote(nights, addOnLines, baseTotal, addOnTotal, baseTotal.add(addOnTotal), currency, nightCount);
    }
}
