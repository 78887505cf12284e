package com.staydesk.pricing.calendar;

import java.time.LocalDate;

/**
 * Thrown before any resolution starts when a date range is empty or reversed.
 * A validation failure of the request, not a computation fault.
 */
public class InvalidStayException extends IllegalArgumentException {

    private final LocalDate start;
    private final LocalDate end;

    public InvalidStayException(String message, LocalDate start, LocalDate end) {
        super(message);
        this.start = start;
        this.end = end;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }
}
