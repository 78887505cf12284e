package com.staydesk.booking.domain.model;

/**
 * Where a booking was made. Online bookings wait for payment; staff bookings start confirmed.
 */
public enum BookingChannel {
    ONLINE,
    PORTAL,
    STAFF
}
