package com.climateplatform.collector.service;

import com.climateplatform.collector.cache.CacheKey;
import com.climateplatform.collector.cache.DatasetCacheStore;
import com.climateplatform.collector.fetcher.SourceFetchException;
import com.climateplatform.collector.fetcher.SourceFetcher;
import com.climateplatform.collector.model.FetchRequest;
import com.climateplatform.collector.registry.SourceRegistry;
import com.climateplatform.common.dataset.TabularDataset;
import com.climateplatform.common.exception.InvalidSourceException;
import com.climateplatform.common.exception.SourceUnavailableException;
import com.climateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Single-source fetch: the unit of work every other collector component calls.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Reject unknown sources with {@link InvalidSourceException} before any I/O.</li>
 *   <li>Derive the {@link CacheKey} from source and parameters.</li>
 *   <li>Look the key up in the {@link DatasetCacheStore}; a hit is returned as-is (cached
 *       entries are trusted indefinitely).</li>
 *   <li>On a miss, call the source's {@link SourceFetcher}, bounded by the source timeout.</li>
 *   <li>Persist the fresh dataset (a failed write is logged by the store, never fatal) and
 *       return it.</li>
 *   <li>Fetcher failures leave as {@link SourceUnavailableException} with the cause attached and
 *       are never cached.</li>
 * </ol>
 *
 * <p><strong>Single-flight:</strong> concurrent requests for the same key share one in-flight
 * load. The first caller starts it; later callers await the same result. The load runs to
 * completion even if a waiter cancels, and its entry is dropped before the result is published,
 * so a request issued after completion always consults the cache again.
 *
 * <p>Cache I/O is blocking and runs on {@code Schedulers.boundedElastic()}.
 */
@Service
public class FetchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FetchCoordinator.class);

    private final SourceRegistry registry;
    private final DatasetCacheStore cacheStore;
    private final Map<String, SourceFetcher> fetchers;
    private final ConcurrentHashMap<CacheKey, CompletableFuture<TabularDataset>> inFlight = new ConcurrentHashMap<>();

    public FetchCoordinator(SourceRegistry registry, DatasetCacheStore cacheStore, List<SourceFetcher> fetchers) {
        this.registry   = registry;
        this.cacheStore = cacheStore;
        this.fetchers   = index(registry, fetchers);
    }

    public Mono<TabularDataset> fetch(String source, Map<String, ?> parameters) {
        return Mono.defer(() -> registry.contains(source)
            ? fetch(FetchRequest.of(source, parameters))
            : Mono.error(new InvalidSourceException(source, registry.sourceIds())));
    }

    public Mono<TabularDataset> fetch(FetchRequest request) {
        return Mono.deferContextual(ctx -> {
            String source = request.source();
            if (!registry.contains(source)) {
                return Mono.error(new InvalidSourceException(source, registry.sourceIds()));
            }
            String traceId = TraceContextUtil.getTraceId(ctx);
            CacheKey key = CacheKey.of(source, request.parameters());
            return shared(key, () -> loadThrough(key, request, traceId), traceId);
        });
    }

    /** True when {@code source} is registered and has a fetcher. */
    public boolean isRegistered(String source) {
        return registry.contains(source);
    }

    public SourceRegistry registry() {
        return registry;
    }

    private Mono<TabularDataset> shared(CacheKey key, Supplier<Mono<TabularDataset>> loader,
                                        String traceId) {
        CompletableFuture<TabularDataset> pending = new CompletableFuture<>();
        CompletableFuture<TabularDataset> existing = inFlight.putIfAbsent(key, pending);
        if (existing != null) {
            TraceContextUtil.withMdc(traceId, () ->
                log.debug("FETCH_COALESCED source={} key={}", key.source(), key.digest()));
            return Mono.fromFuture(existing, true);
        }
        loader.get().subscribe(
            dataset -> {
                inFlight.remove(key, pending);
                pending.complete(dataset);
            },
            error -> {
                inFlight.remove(key, pending);
                pending.completeExceptionally(error);
            });
        return Mono.fromFuture(pending, true);
    }

    private Mono<TabularDataset> loadThrough(CacheKey key, FetchRequest request, String traceId) {
        return Mono.fromCallable(() -> cacheStore.lookup(key))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(cached -> {
                if (cached.isPresent()) {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.info("CACHE_HIT source={} key={} rows={}",
                                 key.source(), key.digest(), cached.get().rowCount()));
                    return Mono.just(cached.get());
                }
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("CACHE_MISS source={} key={}", key.source(), key.digest()));
                return fetchFromSource(key, request, traceId);
            });
    }

    private Mono<TabularDataset> fetchFromSource(CacheKey key, FetchRequest request, String traceId) {
        String source = request.source();
        SourceFetcher fetcher = fetchers.get(source);
        Duration timeout = registry.descriptor(source).timeout();
        long startedAt = System.nanoTime();

        return Mono.defer(() -> fetcher.fetch(request.parameters()))
            .timeout(timeout)
            .switchIfEmpty(Mono.error(() -> new SourceFetchException(source, "fetcher completed without a dataset")))
            .onErrorMap(e -> !(e instanceof SourceUnavailableException), e -> new SourceUnavailableException(source, e))
            .doOnError(e -> TraceContextUtil.withMdc(traceId, () ->
                log.error("FETCH_FAILED source={} key={} elapsedMs={} cause={}",
                          source, key.digest(), elapsedMillis(startedAt), String.valueOf(e.getCause()))))
            .flatMap(dataset -> persist(key, dataset)
                .doOnSuccess(stored -> TraceContextUtil.withMdc(traceId, () ->
                    log.info("FETCH_COMPLETE source={} key={} rows={} cached={} elapsedMs={}",
                             source, key.digest(), dataset.rowCount(), stored, elapsedMillis(startedAt))))
                .thenReturn(dataset));
    }

    private Mono<Boolean> persist(CacheKey key, TabularDataset dataset) {
        return Mono.fromCallable(() -> cacheStore.store(key, dataset))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("CACHE_PERSIST_FAILED source={} key={}", key.source(), key.digest(), e);
                return Mono.just(false);
            });
    }

    private static long elapsedMillis(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    private static Map<String, SourceFetcher> index(SourceRegistry registry, List<SourceFetcher> fetchers) {
        Map<String, SourceFetcher> bySource = new HashMap<>();
        for (SourceFetcher fetcher : fetchers) {
            String id = fetcher.sourceId();
            if (!registry.contains(id)) {
                log.warn("Fetcher {} serves unregistered source '{}'; ignoring it", fetcher.getClass().getSimpleName(), id);
                continue;
            }
            SourceFetcher previous = bySource.put(id, fetcher);
            if (previous != null) {
                throw new IllegalStateException("Source '" + id + "' has two fetchers: "
                    + previous.getClass().getName() + " and " + fetcher.getClass().getName());
            }
        }
        for (String id : registry.sourceIds()) {
            if (!bySource.containsKey(id)) {
                throw new IllegalStateException("No fetcher registered for source '" + id + "'");
            }
        }
        log.info("Fetch coordinator ready. sources={}", registry.sourceIds());
        return Collections.unmodifiableMap(bySource);
    }
}
