package com.climateplatform.common.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * The requested source identifier is not registered. Caller error; raised before any I/O and never retried.
 */
public class InvalidSourceException extends ClimateDataException {
    private final Set<String> knownSources;

    public InvalidSourceException(String source, Set<String> knownSources) {
        super(source, "Unknown data source. Known sources: " + new TreeSet<>(knownSources));
        this.knownSources = Set.copyOf(knownSources);
    }

    public Set<String> getKnownSources() {
        return knownSources;
    }
}
