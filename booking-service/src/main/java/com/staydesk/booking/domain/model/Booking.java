package com.staydesk.booking.domain.model;

import com.staydesk.pricing.calendar.StayRange;
import com.staydesk.pricing.model.BookingStatus;
import com.staydesk.pricing.model.OccupiedStay;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A guest's stay in one room. {@code baseTotal} is the room charge frozen at booking time;
 * {@code totalAmount} is always {@code baseTotal + addonsTotal}.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_room_dates", columnList = "room_id,check_in,check_out"),
        @Index(name = "idx_bookings_status", columnList = "status"),
        @Index(name = "idx_bookings_created_at", columnList = "created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "reference", nullable = false, unique = true, length = 32)
    private String reference;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "room_name", nullable = false, length = 150)
    private String roomName;

    @Column(name = "guest_name", nullable = false, length = 150)
    private String guestName;

    @Column(name = "guest_email", nullable = false, length = 255)
    private String guestEmail;

    @Column(name = "guest_phone", length = 50)
    private String guestPhone;

    @Column(name = "guests", nullable = false)
    private Integer guests;

    @Column(name = "check_in", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out", nullable = false)
    private LocalDate checkOutDate;

    @Convert(converter = BookingStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel", nullable = false, length = 20)
    private BookingChannel channel;

    @Column(name = "base_total", precision = 12, scale = 2)
    private BigDecimal baseTotal;

    @Column(name = "addons_total", nullable = false, precision = 12, scale = 2)
    private BigDecimal addonsTotal;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_addons", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "line_no")
    private List<BookingAddOnItem> addOns = new ArrayList<>();

    @Column(name = "special_requests", length = 2000)
    private String specialRequests;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
        if (status == null) {
            status = BookingStatus.PENDING;
        }
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.PENDING;
        }
        if (channel == null) {
            channel = BookingChannel.ONLINE;
        }
        if (retryCount == null) {
            retryCount = 0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public StayRange stay() {
        return StayRange.of(checkInDate, checkOutDate);
    }

    public OccupiedStay toOccupiedStay() {
        return new OccupiedStay(id, stay(), status);
    }

    /**
     * Room charge without add-ons. Rows written before the base total was stored derive it
     * from the grand total.
     */
    public BigDecimal roomCharge() {
        if (baseTotal != null) {
            return baseTotal;
        }
        BigDecimal addons = addonsTotal == null ? BigDecimal.ZERO : addonsTotal;
        return totalAmount.subtract(addons);
    }

    public int retriesSoFar() {
        return retryCount == null ? 0 : retryCount;
    }
}
