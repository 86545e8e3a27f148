package com.climateplatform.common.exception;

/**
 * The source fetcher could not produce data (network, upstream or parsing failure, or timeout)
 * after its own retry policy was exhausted. The underlying failure is kept as the cause.
 */
public class SourceUnavailableException extends ClimateDataException {

    public SourceUnavailableException(String source, Throwable cause) {
        super(source, "Source unavailable: " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "no data";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
