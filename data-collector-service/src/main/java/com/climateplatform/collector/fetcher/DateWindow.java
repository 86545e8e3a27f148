package com.climateplatform.collector.fetcher;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Inclusive calendar-day window a fetch covers, resolved from request parameters.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>{@code date}: a single day (what historical backfill injects);</li>
 *   <li>{@code start_date} and {@code end_date}: an explicit window;</li>
 *   <li>otherwise the {@value #DEFAULT_DAYS} days ending yesterday (UTC).</li>
 * </ol>
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public static final String DATE       = "date";
    public static final String START_DATE = "start_date";
    public static final String END_DATE   = "end_date";

    static final int DEFAULT_DAYS = 7;

    private static final DateTimeFormatter BASIC = DateTimeFormatter.BASIC_ISO_DATE;

    public DateWindow {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
    }

    public static DateWindow resolve(Map<String, Object> parameters, Clock clock) {
        Object date = parameters.get(DATE);
        if (date != null) {
            LocalDate day = parse(DATE, date);
            return new DateWindow(day, day);
        }
        Object start = parameters.get(START_DATE);
        Object end = parameters.get(END_DATE);
        if (start != null || end != null) {
            if (start == null || end == null) {
                throw new IllegalArgumentException("both " + START_DATE + " and " + END_DATE + " are required");
            }
            return new DateWindow(parse(START_DATE, start), parse(END_DATE, end));
        }
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        return new DateWindow(yesterday.minusDays(DEFAULT_DAYS - 1L), yesterday);
    }

    /** {@code yyyyMMdd} form of the start day. */
    public String startBasic() {
        return start.format(BASIC);
    }

    /** {@code yyyyMMdd} form of the end day. */
    public String endBasic() {
        return end.format(BASIC);
    }

    private static LocalDate parse(String name, Object value) {
        if (value instanceof LocalDate d) return d;
        try {
            return LocalDate.parse(String.valueOf(value).trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("parameter " + name + " is not an ISO date: " + value, e);
        }
    }
}
