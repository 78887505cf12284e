package com.staydesk.booking.api.dto;

import java.math.BigDecimal;

/**
 * Whether a failed booking can be paid for again as it stands.
 */
public record RetryAvailabilityResponse(
        Long bookingId,
        String reference,
        boolean available,
        boolean pricingChanged,
        BigDecimal originalTotal,
        BigDecimal newTotal,
        String currency,
        int retryCount,
        int retriesRemaining
) {
}
