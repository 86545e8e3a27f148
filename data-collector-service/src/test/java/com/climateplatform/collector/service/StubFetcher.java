package com.climateplatform.collector.service;

import com.climateplatform.collector.fetcher.SourceFetcher;
import com.climateplatform.common.dataset.TabularDataset;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** In-memory fetcher that records every call. */
class StubFetcher implements SourceFetcher {

    private final String sourceId;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<Map<String, Object>> requests = new CopyOnWriteArrayList<>();
    private volatile Function<Map<String, Object>, Mono<TabularDataset>> behaviour;

    StubFetcher(String sourceId, Function<Map<String, Object>, Mono<TabularDataset>> behaviour) {
        this.sourceId = sourceId;
        this.behaviour = behaviour;
    }

    static StubFetcher returning(String sourceId, TabularDataset dataset) {
        return new StubFetcher(sourceId, params -> Mono.just(dataset));
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public Mono<TabularDataset> fetch(Map<String, Object> parameters) {
        calls.incrementAndGet();
        requests.add(parameters);
        return behaviour.apply(parameters);
    }

    void behaveAs(Function<Map<String, Object>, Mono<TabularDataset>> behaviour) {
        this.behaviour = behaviour;
    }

    int calls() {
        return calls.get();
    }

    List<Map<String, Object>> requests() {
        return requests;
    }
}
