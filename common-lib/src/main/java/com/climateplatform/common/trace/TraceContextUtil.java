package com.climateplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Lightweight reactive tracing utility.
 *
 * <p>Reactor Context is the single source of truth for traceId inside reactive pipelines.
 * MDC is only ever written as a temporary bridge during a log statement, never as a
 * persistent ThreadLocal store.
 *
 * <p>Usage pattern at the edge of a request:
 * <pre>
 *     return TraceContextUtil.withTraceId(coordinator.fetch(request), traceId);
 * </pre>
 *
 * <p>Usage pattern inside a pipeline:
 * <pre>
 *     Mono.deferContextual(ctx -> {
 *         TraceContextUtil.withMdc(TraceContextUtil.getTraceId(ctx), () -> log.info("..."));
 *         ...
 *     })
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context so every operator upstream of
     * {@code contextWrite} can read it via {@link #getTraceId(ContextView)}.
     *
     * @param mono    the reactive pipeline to enrich
     * @param traceId the trace identifier to propagate
     * @param <T>     pipeline element type
     * @return the same pipeline with traceId stored in its Reactor Context
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /**
     * Retrieves traceId from the Reactor {@link ContextView}.
     * Returns {@code "unknown"} if not present, never {@code null}.
     */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    /** Uses the caller-supplied id when present, otherwise mints a new one. */
    public static String resolveTraceId(String candidate) {
        return candidate == null || candidate.isBlank() ? UUID.randomUUID().toString() : candidate;
    }

    /**
     * Temporarily bridges {@code traceId} into MDC for the duration of {@code logAction},
     * then removes the MDC entry. Only use this inside logging side-effects.
     *
     * @param traceId   the traceId to bridge into MDC
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
