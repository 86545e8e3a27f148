package com.climateplatform.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClimateDataExceptionTest {

    @Test
    @DisplayName("messages are prefixed with the source id")
    void sourcePrefix() {
        InvalidSourceException e = new InvalidSourceException("nope", Set.of("b", "a"));
        assertEquals("nope", e.getSource());
        assertTrue(e.getMessage().startsWith("[nope] "));
        assertTrue(e.getMessage().contains("[a, b]"));
    }

    @Test
    @DisplayName("SourceUnavailableException keeps its cause")
    void causePreserved() {
        IOException cause = new IOException("connection reset");
        SourceUnavailableException e = new SourceUnavailableException("s1", cause);
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("connection reset"));
    }

    @Test
    @DisplayName("InvalidRangeException carries both dates")
    void rangeDates() {
        LocalDate start = LocalDate.of(2024, 1, 10);
        LocalDate end = LocalDate.of(2024, 1, 1);
        InvalidRangeException e = new InvalidRangeException("s1", start, end, "start date is after end date");
        assertEquals(start, e.getStartDate());
        assertEquals(end, e.getEndDate());
        assertInstanceOf(ClimateDataException.class, e);
    }
}
