package com.staydesk.booking.domain.service;

import com.staydesk.booking.domain.model.Booking;
import com.staydesk.booking.domain.model.Room;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.domain.strategy.NightClaim;
import com.staydesk.booking.domain.strategy.ReservationStrategy;
import com.staydesk.pricing.calendar.StayRange;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Map;

/**
 * Claims and releases room-nights in the occupancy ledger.
 *
 * All {@link ReservationStrategy} beans are injected by bean name; the one named by
 * {@code booking.reservation.strategy} (distributed | pessimistic | optimistic) does the claiming.
 * Unknown names fall back to distributed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomNightLedger {

    private static final String DEFAULT_STRATEGY = "distributed";

    private final Map<String, ReservationStrategy> reservationStrategies;
    private final RoomNightOccupancyRepository occupancyRepository;

    @Value("${booking.reservation.strategy:distributed}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Room-night ledger using strategy: {}", getReservationStrategy().getStrategyType());
    }

    /**
     * Takes one unit of {@code room} for every night of {@code stay}. Must run inside the
     * transaction that writes the booking.
     *
     * @throws com.staydesk.booking.exception.BookingConflictException if any night is full
     */
    @Transactional
    public void claim(Room room, StayRange stay) {
        for (LocalDate night : stay.nights()) {
            occupancyRepository.insertNightIfAbsent(room.getTenantId(), room.getId(), night);
        }
        ReservationStrategy strategy = getReservationStrategy();
        log.debug("Claiming {} nights of room {} with {}", stay.nightCount(), room.getId(), strategy.getStrategyType());
        strategy.claimNights(new NightClaim(room.getTenantId(), room.getId(), room.getTotalUnits(), stay));
    }

    /**
     * Gives back the unit a booking held on each of its nights.
     */
    @Transactional
    public void release(Booking booking) {
        int released = 0;
        for (LocalDate night : booking.stay().nights()) {
            released += occupancyRepository.releaseNight(booking.getTenantId(), booking.getRoomId(), night);
        }
        log.info("Released {} room-nights of room {} for booking {}", released, booking.getRoomId(), booking.getReference());
    }

    private ReservationStrategy getReservationStrategy() {
        String strategyKey = strategyType.toLowerCase();
        ReservationStrategy strategy = reservationStrategies.get(strategyKey);

        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to distributed",
                    strategyType, reservationStrategies.keySet());
            strategy = reservationStrategies.get(DEFAULT_STRATEGY);

            if (strategy == null) {
                throw new IllegalStateException(
                        "distributed strategy not found. Available strategies: " + reservationStrategies.keySet());
            }
        }
        return strategy;
    }
}
