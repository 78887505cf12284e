package com.staydesk.booking.domain.strategy;

import com.staydesk.pricing.calendar.StayRange;

import java.util.UUID;

/**
 * One unit of {@code roomId} for every night of {@code stay}, bounded by {@code totalUnits}.
 */
public record NightClaim(UUID tenantId, Long roomId, int totalUnits, StayRange stay) {
}
