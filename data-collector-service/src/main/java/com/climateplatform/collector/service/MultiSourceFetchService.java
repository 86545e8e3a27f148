package com.climateplatform.collector.service;

import com.climateplatform.collector.model.MultiSourceRequest;
import com.climateplatform.common.dataset.TabularDataset;
import com.climateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Fans one parameter set out to several sources in parallel. A source that fails for any reason
 * is logged and left out of the result; the call itself only errors on programming faults.
 */
@Service
public class MultiSourceFetchService {

    private static final Logger log = LoggerFactory.getLogger(MultiSourceFetchService.class);

    private final FetchCoordinator coordinator;

    public MultiSourceFetchService(FetchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public Mono<Map<String, TabularDataset>> fetchMany(MultiSourceRequest request) {
        return fetchMany(request.sources(), request.parameters());
    }

    public Mono<Map<String, TabularDataset>> fetchMany(Collection<String> sources, Map<String, ?> parameters) {
        if (sources == null || sources.isEmpty()) {
            return Mono.just(Map.of());
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>(sources);
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("Dispatching {} sources in parallel. sources={}", distinct.size(), distinct));
            return Flux.fromIterable(distinct)
                .flatMap(source -> Mono.defer(() -> coordinator.fetch(source, parameters))
                    .map(dataset -> Map.entry(source, dataset))
                    .onErrorResume(e -> {
                        TraceContextUtil.withMdc(traceId, () ->
                            log.warn("SOURCE_OMITTED source={} reason={}", source, e.getMessage()));
                        return Mono.empty();
                    }))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                .doOnSuccess(result -> TraceContextUtil.withMdc(traceId, () ->
                    log.info("Multi-source fetch complete. requested={} succeeded={}",
                             distinct.size(), result.keySet())));
        });
    }
}
