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
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * GLOBE Program measurement search ({@code /search/v1/measurement/protocol/measureddate/}).
 *
 * <p>Parameters: {@code protocols} (default {@value #DEFAULT_PROTOCOL}), optional
 * {@code countrycode}, and the usual date window.
 *
 * <p>Output columns: {@code timestamp}, {@code site_name}, {@code latitude}, {@code longitude},
 * then one column per scalar in each measurement's {@code data} object, named in snake_case.
 * Protocols report different fields, so measurement columns are typed from the values seen: a
 * column is numeric when every non-null value is a number, otherwise string.
 */
@Component
public class GlobeFetcher extends AbstractHttpSourceFetcher {

    static final String DEFAULT_PROTOCOL = "air_temp_dailies";

    private static final Set<String> SITE_COLUMNS = Set.of("timestamp", "site_name", "latitude", "longitude");

    public GlobeFetcher(SourceRegistry registry, WebClient.Builder builder,
                        ObjectMapper objectMapper, Clock clock) {
        super(SourceIds.GLOBE, registry, builder, objectMapper, clock);
    }

    @Override
    protected Mono<String> request(Map<String, Object> parameters) {
        DateWindow window = window(parameters);
        String protocols = param(parameters, "protocols").orElse(DEFAULT_PROTOCOL);
        String country = param(parameters, "countrycode").orElse(null);

        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path("/search/v1/measurement/protocol/measureddate/")
                    .queryParam("protocols", protocols)
                    .queryParam("startdate", window.start())
                    .queryParam("enddate", window.end())
                    .queryParam("geojson", "FALSE")
                    .queryParam("sample", "FALSE");
                if (country != null) {
                    uriBuilder.queryParam("countrycode", country);
                }
                return uriBuilder.build();
            })
            .retrieve()
            .bodyToMono(String.class);
    }

    @Override
    protected TabularDataset normalize(JsonNode body, Map<String, Object> parameters) {
        JsonNode results = body.path("results");
        if (!results.isArray()) {
            throw new SourceFetchException(sourceId(), "response has no results array");
        }

        List<Map<String, Object>> rows = new ArrayList<>(results.size());
        Map<String, JsonNodeKind> measurementKinds = new LinkedHashMap<>();
        for (JsonNode result : results) {
            String measured = text(result.path("measuredDate"));
            if (measured == null) continue;
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Timestamps.parse(measured));
            row.put("site_name", text(result.path("siteName")));
            row.put("latitude", number(result.path("latitude"), null));
            row.put("longitude", number(result.path("longitude"), null));

            Iterator<Map.Entry<String, JsonNode>> data = result.path("data").fields();
            while (data.hasNext()) {
                Map.Entry<String, JsonNode> field = data.next();
                JsonNode value = field.getValue();
                if (value.isContainerNode()) continue;
                String column = snakeCase(field.getKey());
                if (SITE_COLUMNS.contains(column)) continue;
                if (value.isNull()) {
                    measurementKinds.putIfAbsent(column, JsonNodeKind.UNKNOWN);
                    row.put(column, null);
                } else {
                    measurementKinds.merge(column, JsonNodeKind.of(value), JsonNodeKind::widen);
                    row.put(column, value);
                }
            }
            rows.add(row);
        }

        TabularDataset.Builder builder = TabularDataset.builder()
            .column("timestamp", ColumnType.TIMESTAMP)
            .column("site_name", ColumnType.STRING)
            .column("latitude", ColumnType.NUMERIC)
            .column("longitude", ColumnType.NUMERIC);
        measurementKinds.forEach((column, kind) ->
            builder.column(column, kind == JsonNodeKind.NUMBER ? ColumnType.NUMERIC : ColumnType.STRING));

        for (Map<String, Object> row : rows) {
            row.replaceAll((column, value) -> value instanceof JsonNode node
                ? (measurementKinds.get(column) == JsonNodeKind.NUMBER ? number(node, null) : node.asText())
                : value);
        }
        rows.sort(Comparator.comparing(row -> (Instant) row.get("timestamp")));
        return builder.rows(rows).build();
    }

    static String snakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").replace('-', '_').toLowerCase(Locale.ROOT);
    }

    private enum JsonNodeKind {
        UNKNOWN, NUMBER, TEXT;

        static JsonNodeKind of(JsonNode value) {
            return value.isNumber() ? NUMBER : TEXT;
        }

        static JsonNodeKind widen(JsonNodeKind a, JsonNodeKind b) {
            if (a == UNKNOWN) return b;
            if (b == UNKNOWN) return a;
            return a == b ? a : TEXT;
        }
    }
}
