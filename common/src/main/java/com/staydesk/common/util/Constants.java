package com.staydesk.common.util;

/**
 * Constants shared by StayDesk modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String ROOM_LOCK_PREFIX = "lock:room:";
    public static final String BOOKING_IDEMPOTENCY_PREFIX = "idempotency:booking:";

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
}
