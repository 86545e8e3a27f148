package com.climateplatform.collector.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Typed view of the {@code collector.*} configuration tree.
 *
 * <pre>
 * collector:
 *   cache:
 *     directory: data/cache
 *   fetch:
 *     default-timeout: 30s
 *   backfill:
 *     concurrency: 4
 *     max-days: 3660
 *   sources:
 *     "[nasa_earth_data]":
 *       base-url: https://power.larc.nasa.gov
 *       defaults:
 *         latitude: 45.42
 * </pre>
 *
 * Map keys containing underscores must be bracketed, as above, or the binder strips them.
 */
@ConfigurationProperties(prefix = "collector")
public record CollectorProperties(
    @DefaultValue Cache cache,
    @DefaultValue Fetch fetch,
    @DefaultValue Backfill backfill,
    @DefaultValue Http http,
    Map<String, Source> sources
) {
    public CollectorProperties {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
    }

    public record Cache(@DefaultValue("data/cache") Path directory) {}

    public record Fetch(@DefaultValue("30s") Duration defaultTimeout) {}

    public record Backfill(
        @DefaultValue("4") int concurrency,
        @DefaultValue("3660") int maxDays
    ) {}

    public record Http(
        @DefaultValue("10000") int connectTimeoutMillis,
        @DefaultValue("15") int readTimeoutSeconds
    ) {}

    /**
     * Connection settings for one source. {@code timeout} falls back to
     * {@link Fetch#defaultTimeout()} when unset.
     */
    public record Source(
        String baseUrl,
        String apiKey,
        Duration timeout,
        @DefaultValue("2") int maxRetries,
        @DefaultValue("500ms") Duration retryBackoff,
        Map<String, String> defaults
    ) {}
}
