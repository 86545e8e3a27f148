package com.climateplatform.collector.cache;

/**
 * Point-in-time counters of a {@link DatasetCacheStore}.
 *
 * @param hits             lookups answered from disk
 * @param misses           lookups that found nothing usable, corrupt entries included
 * @param corruptEntries   entries that existed but could not be decoded
 * @param writes           entries persisted
 * @param persistFailures  writes that failed and were skipped
 */
public record CacheStats(
    long hits,
    long misses,
    long corruptEntries,
    long writes,
    long persistFailures
) {}
