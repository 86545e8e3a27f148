package com.climateplatform.collector.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Day-granular backfill request; both dates inclusive.
 */
public record HistoricalRange(
    String source,
    Map<String, Object> parameters,
    LocalDate startDate,
    LocalDate endDate
) {
    public HistoricalRange {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
