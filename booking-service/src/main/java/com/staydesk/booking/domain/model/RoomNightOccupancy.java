package com.staydesk.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Units of a room held for one night by bookings in an occupying status.
 * One row per (room, night); {@code bookedUnits} never exceeds the room's total units.
 */
@Entity
@Table(name = "room_night_occupancy",
        uniqueConstraints = @UniqueConstraint(name = "uq_room_night", columnNames = {"room_id", "night_date"}),
        indexes = @Index(name = "idx_room_night_tenant", columnList = "tenant_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomNightOccupancy {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "night_date", nullable = false)
    private LocalDate nightDate;

    @Column(name = "booked_units", nullable = false)
    private Integer bookedUnits;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean hasCapacity(int totalUnits) {
        return bookedUnits < totalUnits;
    }

    public void claimUnit(int totalUnits) {
        if (!hasCapacity(totalUnits)) {
            throw new IllegalStateException("No unit left for room " + roomId + " on " + nightDate);
        }
        this.bookedUnits += 1;
    }
}
