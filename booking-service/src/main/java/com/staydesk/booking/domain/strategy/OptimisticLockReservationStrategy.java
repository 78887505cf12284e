package com.staydesk.booking.domain.strategy;

import com.staydesk.booking.domain.model.RoomNightOccupancy;
import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.exception.BookingConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;

/**
 * Version-checked increments of each night row.
 *
 * Flow:
 * 1. Read the night row with its version
 * 2. Check capacity
 * 3. Increment and flush (fails if another transaction bumped the version)
 * 4. A version clash is reported as {@link BookingConflictException}
 *
 * The clash leaves the booking transaction rollback-only, so it is not retried here; the caller
 * repeats the booking with fresh availability.
 */
@Slf4j
@Component("optimistic")
@RequiredArgsConstructor
public class OptimisticLockReservationStrategy implements ReservationStrategy {

    private final RoomNightOccupancyRepository repository;

    @Override
    @Transactional
    public void claimNights(NightClaim claim) {
        for (LocalDate night : claim.stay().nights()) {
            RoomNightOccupancy occupancy = repository
                    .findByTenantIdAndRoomIdAndNightDate(claim.tenantId(), claim.roomId(), night)
                    .orElseThrow(() -> new IllegalStateException(
                            "Missing ledger row for room " + claim.roomId() + " on " + night));

            if (!occupancy.hasCapacity(claim.totalUnits())) {
                throw new BookingConflictException(String.format(
                        "Room %d is fully booked for %s", claim.roomId(), night));
            }

            occupancy.claimUnit(claim.totalUnits());
            try {
                repository.saveAndFlush(occupancy);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Version clash claiming room {} on {}: {}", claim.roomId(), night, e.getMessage());
                throw new BookingConflictException(String.format(
                        "Room %d on %s was updated by a concurrent booking", claim.roomId(), night), e);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "OPTIMISTIC_LOCK";
    }
}
