package com.climateplatform.common.exception;

/**
 * Base of the collector error taxonomy. Every error names the source identifier it concerns.
 */
public class ClimateDataException extends RuntimeException {
    private final String source;

    public ClimateDataException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public ClimateDataException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
