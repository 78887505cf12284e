package com.staydesk.booking.domain.model;

import com.staydesk.pricing.model.BookingStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.staydesk.pricing.model.BookingStatus.*;

/**
 * Status transitions staff may apply to a booking.
 */
public final class BookingLifecycle {

    private static final Map<BookingStatus, Set<BookingStatus>> ALLOWED = new EnumMap<>(BookingStatus.class);

    static {
        ALLOWED.put(PENDING, EnumSet.of(CONFIRMED, CANCELLED, PAYMENT_FAILED, CART_ABANDONED));
        ALLOWED.put(CONFIRMED, EnumSet.of(CHECKED_IN, CANCELLED));
        ALLOWED.put(CHECKED_IN, EnumSet.of(CHECKED_OUT));
        ALLOWED.put(CHECKED_OUT, EnumSet.of(COMPLETED));
        ALLOWED.put(COMPLETED, EnumSet.noneOf(BookingStatus.class));
        ALLOWED.put(CANCELLED, EnumSet.noneOf(BookingStatus.class));
        ALLOWED.put(PAYMENT_FAILED, EnumSet.of(PENDING, CONFIRMED, CANCELLED));
        ALLOWED.put(CART_ABANDONED, EnumSet.of(PENDING, CONFIRMED, CANCELLED));
    }

    private static final Set<BookingStatus> NOT_CANCELLABLE = EnumSet.of(CANCELLED, CHECKED_IN, CHECKED_OUT, COMPLETED);

    private BookingLifecycle() {
    }

    public static boolean canTransition(BookingStatus from, BookingStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    public static boolean isCancellable(BookingStatus status) {
        return !NOT_CANCELLABLE.contains(status);
    }

    /**
     * True when a booking moving from {@code from} to {@code to} starts holding a unit again.
     */
    public static boolean reclaims(BookingStatus from, BookingStatus to) {
        return !from.occupiesInventory() && to.occupiesInventory();
    }

    public static boolean releases(BookingStatus from, BookingStatus to) {
        return from.occupiesInventory() && !to.occupiesInventory();
    }
}
