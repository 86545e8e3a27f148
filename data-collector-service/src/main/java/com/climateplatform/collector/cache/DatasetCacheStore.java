package com.climateplatform.collector.cache;

import com.climateplatform.common.dataset.TabularDataset;

import java.util.Optional;

/**
 * Persistent content-addressable store of fetched datasets.
 *
 * <p>Implementations are blocking; callers on a reactive pipeline must shift calls onto a scheduler
 * meant for blocking work.
 */
public interface DatasetCacheStore {

    /**
     * Returns the dataset cached under {@code key}. Missing, unreadable and corrupt entries all
     * come back as {@link Optional#empty()}; this method never throws for them.
     */
    Optional<TabularDataset> lookup(CacheKey key);

    /**
     * Best-effort write. Returns {@code false} when the entry could not be persisted; the failure
     * is logged and counted, never thrown.
     */
    boolean store(CacheKey key, TabularDataset dataset);

    CacheStats stats();
}
