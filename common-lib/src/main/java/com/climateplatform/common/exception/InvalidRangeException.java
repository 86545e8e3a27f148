package com.climateplatform.common.exception;

import java.time.LocalDate;

/**
 * Malformed historical date range. Caller error; raised before any I/O.
 */
public class InvalidRangeException extends ClimateDataException {
    private final LocalDate startDate;
    private final LocalDate endDate;

    public InvalidRangeException(String source, LocalDate startDate, LocalDate endDate, String reason) {
        super(source, "Invalid date range " + startDate + ".." + endDate + ": " + reason);
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }
}
