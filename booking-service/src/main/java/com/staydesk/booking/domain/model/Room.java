package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.PricedRoom;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A bookable room type of a tenant. Rooms are deactivated, never deleted.
 */
@Entity
@Table(name = "rooms", indexes = {
        @Index(name = "idx_rooms_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "base_price_per_night", nullable = false, precision = 12, scale = 2)
    private BigDecimal basePricePerNight;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "total_units", nullable = false)
    private Integer totalUnits;

    @Column(name = "max_guests", nullable = false)
    private Integer maxGuests;

    @Column(name = "min_stay_nights", nullable = false)
    private Integer minStayNights;

    @Column(name = "max_stay_nights")
    private Integer maxStayNights;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (totalUnits == null) {
            totalUnits = 1;
        }
        if (minStayNights == null) {
            minStayNights = 1;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public PricedRoom toPricedRoom() {
        return new PricedRoom(id, tenantId, name, basePricePerNight, currency, totalUnits, active);
    }

    public boolean meetsMinStay(int nights) {
        return nights >= minStayNights;
    }

    public boolean meetsMaxStay(int nights) {
        return maxStayNights == null || nights <= maxStayNights;
    }
}
