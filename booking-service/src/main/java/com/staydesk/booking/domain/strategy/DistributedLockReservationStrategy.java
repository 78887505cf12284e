package com.staydesk.booking.domain.strategy;

import com.staydesk.booking.domain.repository.RoomNightOccupancyRepository;
import com.staydesk.booking.exception.BookingConflictException;
import com.staydesk.common.exception.BusinessException;
import com.staydesk.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;

/**
 * Redisson lock per room around one guarded UPDATE per night:
 *
 *   UPDATE room_night_occupancy
 *   SET booked_units = booked_units + 1
 *   WHERE room_id = :roomId AND night_date = :night AND booked_units < :totalUnits;
 *
 * The lock serialises bookings of the same room across instances; the guard alone keeps the
 * ledger from overselling, so a lost lock lease never leads to a double booking.
 * 0 rows updated means the night is full.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockReservationStrategy implements ReservationStrategy {

    private final RoomNightOccupancyRepository repository;
    private final RedissonClient redissonClient;

    @Value("${booking.reservation.lock-wait-seconds:5}")
    private long lockWaitSeconds;

    @Value("${booking.reservation.lock-lease-seconds:30}")
    private long lockLeaseSeconds;

    @Override
    @Transactional
    public void claimNights(NightClaim claim) {
        String lockKey = Constants.ROOM_LOCK_PREFIX + claim.roomId();
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitSeconds, lockLeaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new BookingConflictException(
                        "Room " + claim.roomId() + " is being booked by another guest. Please try again.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            claimWithAtomicUpdates(claim);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException("Reservation interrupted", e, "RESERVATION_INTERRUPTED");
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private void claimWithAtomicUpdates(NightClaim claim) {
        for (LocalDate night : claim.stay().nights()) {
            int updatedRows = repository.claimNightAtomically(
                    claim.tenantId(), claim.roomId(), night, claim.totalUnits());

            if (updatedRows == 0) {
                throw new BookingConflictException(String.format(
                        "Room %d was fully booked for %s while this booking was being placed",
                        claim.roomId(), night));
            }
        }
    }
}
