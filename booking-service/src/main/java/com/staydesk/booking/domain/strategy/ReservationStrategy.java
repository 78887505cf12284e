package com.staydesk.booking.domain.strategy;

/**
 * Claims room-nights in the occupancy ledger under one concurrency-control mechanism.
 *
 * Implementations (bean names):
 * - distributed: Redisson lock per room + guarded UPDATE per night
 * - pessimistic: SELECT ... FOR UPDATE on each night row
 * - optimistic: versioned rows, a version clash is a conflict
 *
 * Every implementation joins the caller's transaction and throws
 * {@link com.staydesk.booking.exception.BookingConflictException} when a night is full,
 * so the booking insert rolls back together with the claims already made.
 */
public interface ReservationStrategy {

    void claimNights(NightClaim claim);

    String getStrategyType();
}
