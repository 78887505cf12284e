package com.staydesk.booking.domain.repository;

import com.staydesk.booking.domain.model.RoomNightOccupancy;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Capacity ledger of room-nights. Every write is a single guarded statement or runs under a
 * row lock, so concurrent bookings cannot push a night past the room's total units.
 */
public interface RoomNightOccupancyRepository extends JpaRepository<RoomNightOccupancy, Long> {

    /**
     * Creates the ledger row for a night with zero booked units unless it already exists.
     */
    @Modifying
    @Query(value = """
           INSERT INTO room_night_occupancy (tenant_id, room_id, night_date, booked_units, version)
           VALUES (:tenantId, :roomId, :night, 0, 0)
           ON CONFLICT (room_id, night_date) DO NOTHING
           """, nativeQuery = true)
    int insertNightIfAbsent(@Param("tenantId") UUID tenantId,
                            @Param("roomId") Long roomId,
                            @Param("night") LocalDate night);

    Optional<RoomNightOccupancy> findByTenantIdAndRoomIdAndNightDate(UUID tenantId, Long roomId, LocalDate night);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           SELECT o FROM RoomNightOccupancy o
           WHERE o.tenantId = :tenantId AND o.roomId = :roomId AND o.nightDate = :night
           """)
    Optional<RoomNightOccupancy> findNightWithLock(@Param("tenantId") UUID tenantId,
                                                   @Param("roomId") Long roomId,
                                                   @Param("night") LocalDate night);

    List<RoomNightOccupancy> findByTenantIdAndRoomIdAndNightDateBetweenOrderByNightDate(
            UUID tenantId, Long roomId, LocalDate from, LocalDate to);

    /**
     * Takes one unit of the night if one is left.
     *
     * Returns 1 when the unit was taken, 0 when the night is already full.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE RoomNightOccupancy o
           SET o.bookedUnits = o.bookedUnits + 1, o.version = o.version + 1
           WHERE o.tenantId = :tenantId
             AND o.roomId = :roomId
             AND o.nightDate = :night
             AND o.bookedUnits < :totalUnits
           """)
    int claimNightAtomically(@Param("tenantId") UUID tenantId,
                             @Param("roomId") Long roomId,
                             @Param("night") LocalDate night,
                             @Param("totalUnits") int totalUnits);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE RoomNightOccupancy o
           SET o.bookedUnits = o.bookedUnits - 1, o.version = o.version + 1
           WHERE o.tenantId = :tenantId
             AND o.roomId = :roomId
             AND o.nightDate = :night
             AND o.bookedUnits > 0
           """)
    int releaseNight(@Param("tenantId") UUID tenantId,
                     @Param("roomId") Long roomId,
                     @Param("night") LocalDate night);
}
