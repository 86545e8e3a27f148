package com.climateplatform.collector.fetcher;

/**
 * Failure inside a {@link SourceFetcher}: request building, transport, upstream error status or
 * response normalization. Distinct from cache errors; the coordinator wraps it in
 * {@link com.climateplatform.common.exception.SourceUnavailableException}.
 */
public class SourceFetchException extends RuntimeException {
    private final String sourceId;

    public SourceFetchException(String sourceId, String message) {
        super("[" + sourceId + "] " + message);
        this.sourceId = sourceId;
    }

    public SourceFetchException(String sourceId, String message, Throwable cause) {
        super("[" + sourceId + "] " + message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
