package com.climateplatform.collector.fetcher;

import com.climateplatform.common.dataset.TabularDataset;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Strategy for one registered source: retrieves raw data for a parameter mapping and normalizes it
 * into a {@link TabularDataset}.
 *
 * <p>The returned {@code Mono} is the fetch outcome: it emits exactly one dataset on success or
 * signals a {@link SourceFetchException} on any I/O, upstream or parsing failure. Implementations
 * hold no shared mutable state beyond read-only configuration and may be invoked concurrently.
 */
public interface SourceFetcher {

    /** Source identifier this fetcher serves, matched exactly against fetch requests. */
    String sourceId();

    Mono<TabularDataset> fetch(Map<String, Object> parameters);
}
