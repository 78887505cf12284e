package com.staydesk.booking.domain.model;

import com.staydesk.pricing.calendar.DateWindow;
import com.staydesk.pricing.model.RateOverride;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Time-bounded override of a room's nightly price. Both dates are nights the rate covers.
 */
@Entity
@Table(name = "seasonal_rates", indexes = {
        @Index(name = "idx_seasonal_rates_room_window", columnList = "room_id,start_date,end_date")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalRate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "price_per_night", nullable = false, precision = 12, scale = 2)
    private BigDecimal pricePerNight;

    @Column(name = "priority", nullable = false)
    private Integer priority;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (priority == null) {
            priority = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public RateOverride toRateOverride() {
        return new RateOverride(
                id,
                name,
                DateWindow.of(startDate, endDate),
                pricePerNight,
                priority == null ? 0 : priority,
                createdAt == null ? null : createdAt.toInstant(ZoneOffset.UTC));
    }
}
