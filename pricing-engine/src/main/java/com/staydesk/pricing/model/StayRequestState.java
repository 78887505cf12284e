package com.staydesk.pricing.model;

/**
 * States a stay request passes through while a booking is created. None of them is stored;
 * a failure after {@link #PRICED} restarts from {@link #DRAFT}.
 */
public enum StayRequestState {
    DRAFT,
    REJECTED_UNAVAILABLE,
    PRICED,
    BOOKED
}
