package com.climateplatform.collector.registry;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only connection and fetch configuration of one registered source.
 *
 * @param id             source identifier, matched exactly against fetch requests
 * @param baseUrl        upstream API root
 * @param apiKey         credential sent by fetchers that need one; may be blank
 * @param timeout        upper bound for a single fetch, retries included
 * @param maxRetries     retries of transient upstream failures
 * @param retryBackoff   first backoff delay, doubled on each retry
 * @param defaults       request parameters applied when a request does not set them
 */
public record SourceDescriptor(
    String id,
    String baseUrl,
    String apiKey,
    Duration timeout,
    int maxRetries,
    Duration retryBackoff,
    Map<String, Object> defaults
) {
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public SourceDescriptor {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("source id must not be blank");
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        retryBackoff = retryBackoff == null ? Duration.ofMillis(500) : retryBackoff;
        maxRetries = Math.max(0, maxRetries);
        defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    public static SourceDescriptor of(String id, String baseUrl) {
        return new SourceDescriptor(id, baseUrl, null, DEFAULT_TIMEOUT, 0, Duration.ofMillis(500), Map.of());
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
