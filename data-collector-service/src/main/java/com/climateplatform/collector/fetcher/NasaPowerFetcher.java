package com.climateplatform.collector.fetcher;

import com.climateplatform.collector.registry.SourceIds;
import com.climateplatform.collector.registry.SourceRegistry;
import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * NASA POWER daily point API ({@code /api/temporal/daily/point}), the NASA Earth data source.
 *
 * <p>Parameters: {@code latitude}, {@code longitude} (required, usually configured as source
 * defaults), {@code parameters} (comma-separated POWER parameter names, default {@code T2M}),
 * {@code community} (default {@code RE}) and the usual date window.
 *
 * <p>Output columns: {@code timestamp} plus one numeric column per POWER parameter, lower-cased
 * ({@code T2M} → {@code t2m}). The API's fill value (normally {@code -999}) becomes null.
 */
@Component
public class NasaPowerFetcher extends AbstractHttpSourceFetcher {

    static final String DEFAULT_PARAMETERS = "T2M";
    static final String DEFAULT_COMMUNITY  = "RE";
    private static final double DEFAULT_FILL_VALUE = -999.0;

    public NasaPowerFetcher(SourceRegistry registry, WebClient.Builder builder,
                            ObjectMapper objectMapper, Clock clock) {
        super(SourceIds.NASA_EARTH_DATA, registry, builder, objectMapper, clock);
    }

    @Override
    protected Mono<String> request(Map<String, Object> parameters) {
        DateWindow window = window(parameters);
        String latitude  = requireParam(parameters, "latitude");
        String longitude = requireParam(parameters, "longitude");
        String power     = param(parameters, "parameters").orElse(DEFAULT_PARAMETERS);
        String community = param(parameters, "community").orElse(DEFAULT_COMMUNITY);

        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/temporal/daily/point")
                .queryParam("parameters", power)
                .queryParam("community", community)
                .queryParam("latitude", latitude)
                .queryParam("longitude", longitude)
                .queryParam("start", window.startBasic())
                .queryParam("end", window.endBasic())
                .queryParam("format", "JSON")
                .build())
            .retrieve()
            .bodyToMono(String.class);
    }

    @Override
    protected TabularDataset normalize(JsonNode body, Map<String, Object> parameters) {
        JsonNode series = body.path("properties").path("parameter");
        if (!series.isObject()) {
            JsonNode messages = body.path("messages");
            throw new SourceFetchException(sourceId(),
                "response has no properties.parameter block" + (messages.isMissingNode() ? "" : ": " + messages));
        }
        double fill = body.path("header").path("fill_value").asDouble(DEFAULT_FILL_VALUE);

        // day (yyyyMMdd) -> column -> value; TreeMap keeps days ascending
        TreeMap<String, Map<String, Object>> byDay = new TreeMap<>();
        List<String> columns = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = series.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> parameter = fields.next();
            String column = parameter.getKey().toLowerCase(Locale.ROOT);
            columns.add(column);
            parameter.getValue().fields().forEachRemaining(day ->
                byDay.computeIfAbsent(day.getKey(), d -> new LinkedHashMap<>())
                     .put(column, number(day.getValue(), fill)));
        }

        TabularDataset.Builder builder = TabularDataset.builder().column("timestamp", ColumnType.TIMESTAMP);
        columns.forEach(c -> builder.column(c, ColumnType.NUMERIC));
        byDay.forEach((day, values) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Timestamps.parse(day));
            row.putAll(values);
            builder.row(row);
        });
        return builder.build();
    }
}
