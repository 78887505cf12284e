package com.staydesk.booking.domain.strategy;

import com.staydesk.booking.domain.model.RoomNightOccupancy;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.exception.BookingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * SELECT ... FOR UPDATE on each night row, then increments in Java.
 * Nights are locked in ascending date order so two bookings of the same room cannot deadlock.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockReservationStrategy implements ReservationStrategy {

    private final RoomNightOccupancyRepository repository;

    @Override
    @Transactional
    public void claimNights(NightClaim claim) {
        for (LocalDate night : claim.stay().nights()) {
            RoomNightOccupancy occupancy = repository
                    .findNightWithLock(claim.tenantId(), claim.roomId(), night)
                    .orElseThrow(() -> new IllegalStateException(
                            "Missing ledger row for room " + claim.roomId() + " on " + night));

            if (!occupancy.hasCapacity(claim.totalUnits())) {
                throw new BookingConflictException(String.format(
                        "Room %d is fully booked for %s", claim.roomId(), night));
            }

            occupancy.claimUnit(claim.totalUnits());
            repository.save(occupancy);
        }
        log.debug("Claimed {} nights of room {} under row locks", claim.stay().nightCount(), claim.roomId());
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
