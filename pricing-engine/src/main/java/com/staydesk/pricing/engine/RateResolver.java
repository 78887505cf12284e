package com.staydesk.pricing.engine;

import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.NightlyPriceLine;
import com.staydesk.pricing.model.PricedRoom;
import com.staydesk.pricing.model.RateOverride;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits a stay into nights and prices each one.
 *
 * A night takes the price of the winning seasonal rate whose inclusive window contains it
 * (see {@link RatePrecedence}), otherwise the room's base price. Rates that do not touch the
 * stay may be passed in; containment is checked per night. Stateless and thread-safe.
 */
@Slf4j
public class RateResolver {

    public List<NightlyPriceLine> resolve(PricedRoom room, Collection<RateOverride> seasonalRates, StayRange stay) {
        List<RateOverride> candidates = seasonalRates == null
                ? List.of()
                : seasonalRates.stream()
                        .filter(rate -> rate.window().intersects(stay))
                        .sorted(RatePrecedence.WINNER_FIRST)
                        .toList();

        List<NightlyPriceLine> lines = new ArrayList<>(stay.nightCount());
        for (LocalDate night : stay.nights()) {
            lines.add(priceNight(room, candidates, night));
        }
        log.debug("Resolved {} night(s) for room {} {} against {} candidate rate(s)",
                lines.size(), room.id(), stay, candidates.size());
        return lines;
    }

    /**
     * Prices one night. {@code rankedRates} must already be in {@link RatePrecedence#WINNER_FIRST} order.
     */
    private NightlyPriceLine priceNight(PricedRoom room, List<RateOverride> rankedRates, LocalDate night) {
        for (RateOverride rate : rankedRates) {
            if (rate.covers(night)) {
                return new NightlyPriceLine(night, rate.pricePerNight(), rate.name());
            }
        }
        return new NightlyPriceLine(night, room.basePricePerNight(), null);
    }
}
