package com.staydesk.booking.domain.service;

import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.model.SeasonalRate;
import com.staydesk.booking.domain.repository.SeasonalRateRepository;
import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.RateOverride;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Loads the seasonal rates covering a stay in a transaction of its own, so a failed lookup
 * rolls back only itself and the caller's booking or quote transaction stays usable.
 */
@Component
@RequiredArgsConstructor
public class SeasonalRateLookup {

    private final SeasonalRateRepository rateRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<RateOverride> findCoveringRates(Room room, StayRange stay) {
        return rateRepository.findCoveringNights(
                        room.getTenantId(), room.getId(), stay.checkIn(), stay.checkOut().minusDays(1))
                .stream()
                .map(SeasonalRate::toRateOverride)
                .toList();
    }
}
