package com.climateplatform.common.exception;

/**
 * A fetched dataset could not be written to the cache. Non-fatal: logged and counted, never
 * propagated to the caller of a fetch.
 */
public class CachePersistException extends ClimateDataException {
    private final String cacheKey;

    public CachePersistException(String source, String cacheKey, Throwable cause) {
        super(source, "Failed to persist cache entry " + cacheKey, cause);
        this.cacheKey = cacheKey;
    }

    public String getCacheKey() {
        return cacheKey;
    }
}
