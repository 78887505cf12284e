package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.AddOnPricingType;
import com.staydesk.pricing.model.AddOnSelection;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Extra a guest can buy with a stay (breakfast, parking, airport transfer).
 * An empty room set means the add-on is offered with every room.
 */
@Entity
@Table(name = "addons", indexes = {
        @Index(name = "idx_addons_tenant", columnList = "tenant_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddOn {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Convert(converter = AddOnPricingTypeConverter.class)
    @Column(name = "pricing_type", nullable = false, length = 30)
    private AddOnPricingType pricingType;

    @Column(name = "max_quantity", nullable = false)
    private Integer maxQuantity;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "addon_rooms", joinColumns = @JoinColumn(name = "addon_id"))
    @Column(name = "room_id", nullable = false)
    private Set<Long> availableForRooms = new HashSet<>();

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
        if (pricingType == null) {
            pricingType = AddOnPricingType.PER_BOOKING;
        }
        if (maxQuantity == null) {
            maxQuantity = 1;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isOfferedWith(Long roomId) {
        return availableForRooms == null || availableForRooms.isEmpty() || availableForRooms.contains(roomId);
    }

    public AddOnSelection select(int quantity) {
        return new AddOnSelection(id, name, price, quantity, pricingType);
    }
}
