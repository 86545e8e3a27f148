package com.climateplatform.collector.controller;

import com.climateplatform.collector.cache.CacheStats;
import com.climateplatform.collector.cache.DatasetCacheStore;
import com.climateplatform.collector.dto.BatchResponse;
import com.climateplatform.collector.dto.ClimateDataResponse;
import com.climateplatform.collector.dto.ValidationResponse;
import com.climateplatform.collector.fetcher.DateWindow;
import com.climateplatform.collector.model.MultiSourceRequest;
import com.climateplatform.collector.processing.DatasetPreprocessor;
import com.climateplatform.collector.processing.DatasetValidator;
import com.climateplatform.collector.registry.SourceRegistry;
import com.climateplatform.collector.service.FetchCoordinator;
import com.climateplatform.collector.service.HistoricalBackfillService;
import com.climateplatform.collector.service.MultiSourceFetchService;
import com.climateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST adapter over the collector core. Query parameters other than the documented ones are
 * passed through to the source fetcher unchanged.
 */
@RestController
@RequestMapping("/api/v1/climate-data")
public class ClimateDataController {

    private static final Logger log = LoggerFactory.getLogger(ClimateDataController.class);

    private final FetchCoordinator coordinator;
    private final MultiSourceFetchService multiSourceFetchService;
    private final HistoricalBackfillService backfillService;
    private final SourceRegistry registry;
    private final DatasetCacheStore cacheStore;

    public ClimateDataController(FetchCoordinator coordinator,
                                 MultiSourceFetchService multiSourceFetchService,
                                 HistoricalBackfillService backfillService,
                                 SourceRegistry registry,
                                 DatasetCacheStore cacheStore) {
        this.coordinator             = coordinator;
        this.multiSourceFetchService = multiSourceFetchService;
        this.backfillService         = backfillService;
        this.registry                = registry;
        this.cacheStore              = cacheStore;
    }

    @GetMapping("/sources")
    public ResponseEntity<Set<String>> sources() {
        return ResponseEntity.ok(registry.sourceIds());
    }

    @GetMapping("/{source}")
    public Mono<ResponseEntity<ClimateDataResponse>> fetch(
            @PathVariable String source,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        log.info("Fetch request received. source={} params={} traceId={}", source, params.keySet(), traceId);
        return TraceContextUtil.withTraceId(
            coordinator.fetch(source, params)
                .map(dataset -> traced(traceId, ClimateDataResponse.success(source, dataset))),
            traceId);
    }

    @GetMapping("/{source}/processed")
    public Mono<ResponseEntity<ClimateDataResponse>> fetchProcessed(
            @PathVariable String source,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return TraceContextUtil.withTraceId(
            coordinator.fetch(source, params)
                .map(DatasetPreprocessor::clean)
                .map(dataset -> traced(traceId, ClimateDataResponse.success(source, dataset))),
            traceId);
    }

    @GetMapping("/{source}/validation")
    public Mono<ResponseEntity<ValidationResponse>> validate(
            @PathVariable String source,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        return TraceContextUtil.withTraceId(
            coordinator.fetch(source, params)
                .map(dataset -> {
                    Map<String, Boolean> checks = DatasetValidator.validate(dataset);
                    boolean valid = checks.values().stream().allMatch(Boolean::booleanValue);
                    return traced(traceId, new ValidationResponse(source, dataset.rowCount(), valid, checks));
                }),
            traceId);
    }

    @GetMapping("/{source}/history")
    public Mono<ResponseEntity<ClimateDataResponse>> history(
            @PathVariable String source,
            @RequestParam(DateWindow.START_DATE) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(DateWindow.END_DATE) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam Map<String, String> params,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        Map<String, String> passThrough = new LinkedHashMap<>(params);
        passThrough.remove(DateWindow.START_DATE);
        passThrough.remove(DateWindow.END_DATE);
        log.info("History request received. source={} start={} end={} traceId={}", source, startDate, endDate, traceId);
        return TraceContextUtil.withTraceId(
            backfillService.fetchRange(source, passThrough, startDate, endDate)
                .map(dataset -> traced(traceId, ClimateDataResponse.success(source, dataset))),
            traceId);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchResponse>> batch(
            @RequestBody MultiSourceRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolveTraceId(traceHeader);
        log.info("Batch request received. sources={} traceId={}", request.sources(), traceId);
        return TraceContextUtil.withTraceId(
            multiSourceFetchService.fetchMany(request)
                .map(data -> {
                    List<String> failed = new ArrayList<>(new LinkedHashSet<>(request.sources()));
                    failed.removeAll(data.keySet());
                    String status = failed.isEmpty() ? "success" : data.isEmpty() ? "failed" : "partial";
                    return traced(traceId, new BatchResponse(status, data, failed));
                }),
            traceId);
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(cacheStore.stats());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static <T> ResponseEntity<T> traced(String traceId, T body) {
        return ResponseEntity.ok().header(TraceContextUtil.TRACE_ID_HEADER, traceId).body(body);
    }
}
