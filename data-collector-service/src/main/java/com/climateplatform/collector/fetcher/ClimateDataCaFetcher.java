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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Canadian daily climate observations from the MSC GeoMet OGC API {@code climate-daily}
 * collection, the service ClimateData.ca draws its station data from.
 *
 * <p>Parameters: {@code climate_identifier} (station, usually a source default), optional
 * {@code limit} (default {@value #DEFAULT_LIMIT}) and the usual date window.
 *
 * <p>Output columns: {@code timestamp}, {@code station}, {@code mean_temperature},
 * {@code min_temperature}, {@code max_temperature}, {@code total_precipitation}.
 */
@Component
public class ClimateDataCaFetcher extends AbstractHttpSourceFetcher {

    static final int DEFAULT_LIMIT = 10_000;

    private static final Map<String, String> NUMERIC_PROPERTIES = Map.of(
        "mean_temperature",    "MEAN_TEMPERATURE",
        "min_temperature",     "MIN_TEMPERATURE",
        "max_temperature",     "MAX_TEMPERATURE",
        "total_precipitation", "TOTAL_PRECIPITATION"
    );
    private static final List<String> NUMERIC_COLUMNS =
        List.of("mean_temperature", "min_temperature", "max_temperature", "total_precipitation");

    public ClimateDataCaFetcher(SourceRegistry registry, WebClient.Builder builder,
                                ObjectMapper objectMapper, Clock clock) {
        super(SourceIds.CLIMATE_DATA_CA, registry, builder, objectMapper, clock);
    }

    @Override
    protected Mono<String> request(Map<String, Object> parameters) {
        DateWindow window = window(parameters);
        String station = requireParam(parameters, "climate_identifier");
        String limit = param(parameters, "limit").orElse(String.valueOf(DEFAULT_LIMIT));

        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/collections/climate-daily/items")
                .queryParam("f", "json")
                .queryParam("CLIMATE_IDENTIFIER", station)
                .queryParam("datetime", window.start() + "/" + window.end())
                .queryParam("sortby", "LOCAL_DATE")
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .bodyToMono(String.class);
    }

    @Override
    protected TabularDataset normalize(JsonNode body, Map<String, Object> parameters) {
        JsonNode features = body.path("features");
        if (!features.isArray()) {
            throw new SourceFetchException(sourceId(), "response is not a feature collection");
        }
        List<Map<String, Object>> rows = new ArrayList<>(features.size());
        for (JsonNode feature : features) {
            JsonNode props = feature.path("properties");
            String localDate = text(props.path("LOCAL_DATE"));
            if (localDate == null) {
                log.debug("Skipping feature without LOCAL_DATE. id={}", text(feature.path("id")));
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Timestamps.parse(localDate));
            row.put("station", text(props.path("STATION_NAME")));
            for (String column : NUMERIC_COLUMNS) {
                row.put(column, number(props.path(NUMERIC_PROPERTIES.get(column)), null));
            }
            rows.add(row);
        }
        rows.sort(Comparator.comparing(row -> (Instant) row.get("timestamp")));

        TabularDataset.Builder builder = TabularDataset.builder()
            .column("timestamp", ColumnType.TIMESTAMP)
            .column("station", ColumnType.STRING);
        NUMERIC_COLUMNS.forEach(c -> builder.column(c, ColumnType.NUMERIC));
        return builder.rows(rows).build();
    }
}
