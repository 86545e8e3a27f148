package com.climateplatform.collector.service;

import com.climateplatform.collector.fetcher.DateWindow;
import com.climateplatform.collector.model.FetchRequest;
import com.climateplatform.collector.model.HistoricalRange;
import com.climateplatform.common.dataset.TabularDataset;
import com.climateplatform.common.exception.InvalidRangeException;
import com.climateplatform.common.exception.InvalidSourceException;
import com.climateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * Day-granular backfill over the {@link FetchCoordinator}.
 *
 * <p>The range is split into one request per calendar day, each carrying the day as
 * {@code date=yyyy-MM-dd} in a copy of the caller's parameters. Up to {@code concurrency} days
 * are in flight at once; results are merged in day order regardless of completion order, days
 * without rows are skipped, and the survivors are concatenated. Any failing day fails the range.
 *
 * <p>Besides a start date after the end date, a range longer than {@code maxDays} calendar days
 * (the {@code collector.backfill.max-days} setting) is rejected with {@link InvalidRangeException}
 * before any fetch is issued. Raise the setting to admit longer ranges.
 */
public class HistoricalBackfillService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalBackfillService.class);

    private final FetchCoordinator coordinator;
    private final int concurrency;
    private final int maxDays;

    public HistoricalBackfillService(FetchCoordinator coordinator, int concurrency, int maxDays) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("backfill concurrency must be >= 1, got " + concurrency);
        }
        if (maxDays < 1) {
            throw new IllegalArgumentException("backfill max-days must be >= 1, got " + maxDays);
        }
        this.coordinator = coordinator;
        this.concurrency = concurrency;
        this.maxDays     = maxDays;
    }

    public Mono<TabularDataset> fetchRange(HistoricalRange range) {
        return fetchRange(range.source(), range.parameters(), range.startDate(), range.endDate());
    }

    public Mono<TabularDataset> fetchRange(String source, Map<String, ?> parameters,
                                           LocalDate startDate, LocalDate endDate) {
        return Mono.deferContextual(ctx -> {
            if (!coordinator.isRegistered(source)) {
                return Mono.error(new InvalidSourceException(source, coordinator.registry().sourceIds()));
            }
            if (startDate == null || endDate == null) {
                return Mono.error(new InvalidRangeException(source, startDate, endDate, "both dates are required"));
            }
            if (startDate.isAfter(endDate)) {
                return Mono.error(new InvalidRangeException(source, startDate, endDate, "start date is after end date"));
            }
            long days = ChronoUnit.DAYS.between(startDate, endDate) + 1;
            if (days > maxDays) {
                return Mono.error(new InvalidRangeException(source, startDate, endDate,
                    "range spans " + days + " days, limit is " + maxDays));
            }

            String traceId = TraceContextUtil.getTraceId(ctx);
            FetchRequest base = FetchRequest.of(source, parameters);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("BACKFILL_START source={} start={} end={} days={} concurrency={}",
                         source, startDate, endDate, days, concurrency));

            return Flux.fromStream(() -> startDate.datesUntil(endDate.plusDays(1)))
                .flatMapSequential(day -> coordinator.fetch(base.with(DateWindow.DATE, day.toString())),
                                   concurrency)
                .filter(dataset -> !dataset.isEmpty())
                .collectList()
                .map(TabularDataset::concat)
                .doOnSuccess(result -> TraceContextUtil.withMdc(traceId, () ->
                    log.info("BACKFILL_COMPLETE source={} start={} end={} rows={}",
                             source, startDate, endDate, result.rowCount())));
        });
    }
}
