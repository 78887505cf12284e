package com.staydesk.pricing.engine;

import com.staydesk.pricing.model.RateOverride;

import java.time.Instant;
import java.util.Comparator;

/**
 * Orders seasonal rates competing for the same night, winner first.
 *
 * <ol>
 *   <li>higher {@code priority}</li>
 *   <li>narrower window (fewer nights)</li>
 *   <li>more recently created; rates without a creation time come last</li>
 *   <li>lower id; rates without an id come last</li>
 * </ol>
 */
public final class RatePrecedence {

    public static final Comparator<RateOverride> WINNER_FIRST = Comparator
            .comparingInt(RateOverride::priority).reversed()
            .thenComparingLong(rate -> rate.window().spanDays())
            .thenComparing(RateOverride::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(RateOverride::id, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private RatePrecedence() {
    }
}
