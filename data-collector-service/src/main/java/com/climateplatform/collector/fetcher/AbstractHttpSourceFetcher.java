package com.climateplatform.collector.fetcher;

import com.climateplatform.collector.registry.SourceDescriptor;
import com.climateplatform.collector.registry.SourceRegistry;
import com.climateplatform.common.dataset.TabularDataset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Shared plumbing for fetchers that call a JSON HTTP API.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Merge the source's configured default parameters under the request parameters.</li>
 *   <li>{@link #request} issues the call and yields the raw response body.</li>
 *   <li>Transient failures (5xx, 429, connection errors, timeouts) are retried with exponential
 *       backoff, {@link SourceDescriptor#maxRetries()} times starting at
 *       {@link SourceDescriptor#retryBackoff()}.</li>
 *   <li>{@link #normalize} turns the parsed body into a {@link TabularDataset}.</li>
 *   <li>Any failure leaves as a {@link SourceFetchException}.</li>
 * </ol>
 */
public abstract class AbstractHttpSourceFetcher implements SourceFetcher {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final SourceDescriptor descriptor;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractHttpSourceFetcher(String sourceId,
                                        SourceRegistry registry,
                                        WebClient.Builder builder,
                                        ObjectMapper objectMapper,
                                        Clock clock) {
        this.descriptor   = registry.descriptor(sourceId);
        this.webClient    = builder.clone().baseUrl(descriptor.baseUrl()).build();
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public String sourceId() {
        return descriptor.id();
    }

    @Override
    public Mono<TabularDataset> fetch(Map<String, Object> parameters) {
        Map<String, Object> effective = new LinkedHashMap<>(descriptor.defaults());
        if (parameters != null) {
            effective.putAll(parameters);
        }
        return Mono.defer(() -> request(effective))
            .retryWhen(Retry.backoff(descriptor.maxRetries(), descriptor.retryBackoff())
                .filter(AbstractHttpSourceFetcher::isTransient)
                .doBeforeRetry(signal -> log.warn("Retrying {} fetch. attempt={} cause={}",
                    sourceId(), signal.totalRetries() + 1, signal.failure().toString()))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
            .defaultIfEmpty("")
            .map(body -> normalize(readTree(body), effective))
            .doOnSuccess(dataset -> log.info("Source data fetched. source={} rows={}", sourceId(), dataset.rowCount()))
            .onErrorMap(e -> !(e instanceof SourceFetchException),
                        e -> new SourceFetchException(sourceId(), "fetch failed: " + e.getMessage(), e));
    }

    /**
     * Issues the upstream call(s) for {@code parameters} (defaults already merged). Invoked lazily,
     * once per attempt.
     */
    protected abstract Mono<String> request(Map<String, Object> parameters);

    /** Converts the parsed response body into a dataset, rows in ascending timestamp order. */
    protected abstract TabularDataset normalize(JsonNode body, Map<String, Object> parameters);

    protected DateWindow window(Map<String, Object> parameters) {
        return DateWindow.resolve(parameters, clock);
    }

    protected static Optional<String> param(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) return Optional.empty();
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    protected String requireParam(Map<String, Object> parameters, String name) {
        return param(parameters, name).orElseThrow(() ->
            new SourceFetchException(sourceId(), "missing required parameter '" + name + "'"));
    }

    /** Numeric JSON value, or {@code null} for JSON null, missing nodes and the given fill value. */
    protected static Double number(JsonNode node, Double fillValue) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (fillValue != null && Double.compare(value, fillValue) == 0) return null;
        return value;
    }

    protected static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        return node.asText();
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            throw new SourceFetchException(sourceId(), "response is not valid JSON", e);
        }
    }

    static boolean isTransient(Throwable e) {
        if (e instanceof WebClientResponseException r) {
            return r.getStatusCode().is5xxServerError() || r.getStatusCode().value() == 429;
        }
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }
}
