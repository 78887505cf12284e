package com.staydesk.pricing.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Validity window of a seasonal rate: both {@code start} and {@code end} are nights the rate covers.
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new InvalidStayException(
                    String.format("Window end %s is before start %s", end, start), start, end);
        }
    }

    public static DateWindow of(LocalDate start, LocalDate end) {
        return new DateWindow(start, end);
    }

    public boolean contains(LocalDate night) {
        return !night.isBefore(start) && !night.isAfter(end);
    }

    /**
     * Number of nights covered, counting both ends.
     */
    public long spanDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /**
     * True if at least one night of {@code stay} falls inside this window.
     */
    public boolean intersects(StayRange stay) {
        return !start.isAfter(stay.checkOut().minusDays(1)) && !end.isBefore(stay.checkIn());
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
