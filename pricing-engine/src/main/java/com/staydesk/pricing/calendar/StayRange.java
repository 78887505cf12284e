package com.staydesk.pricing.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An occupancy of a room: nights from {@code checkIn} up to, but not including, {@code checkOut}.
 *
 * Two stays compete for a unit-night only if they share a night, so the range is half-open:
 * a guest checking out on day X and another checking in on day X do not conflict.
 * Seasonal-rate windows use the inclusive semantics of {@link DateWindow} instead.
 */
public record StayRange(LocalDate checkIn, LocalDate checkOut) {

    public StayRange {
        Objects.requireNonNull(checkIn, "checkIn");
        Objects.requireNonNull(checkOut, "checkOut");
        if (!checkOut.isAfter(checkIn)) {
            throw new InvalidStayException(
                    String.format("Check-out %s must be after check-in %s", checkOut, checkIn),
                    checkIn, checkOut);
        }
    }

    public static StayRange of(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null) {
            throw new InvalidStayException("Check-in and check-out dates are required", checkIn, checkOut);
        }
        return new StayRange(checkIn, checkOut);
    }

    public int nightCount() {
        return (int) ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    /**
     * Every night of the stay in ascending order; the check-out day is not a night.
     */
    public List<LocalDate> nights() {
        List<LocalDate> nights = new ArrayList<>(nightCount());
        LocalDate current = checkIn;
        while (current.isBefore(checkOut)) {
            nights.add(current);
            current = current.plusDays(1);
        }
        return nights;
    }

    public boolean containsNight(LocalDate night) {
        return !night.isBefore(checkIn) && night.isBefore(checkOut);
    }

    public boolean overlaps(StayRange other) {
        return checkIn.isBefore(other.checkOut) && other.checkIn.isBefore(checkOut);
    }

    @Override
    public String toString() {
        return "[" + checkIn + ", " + checkOut + ")";
    }
}
