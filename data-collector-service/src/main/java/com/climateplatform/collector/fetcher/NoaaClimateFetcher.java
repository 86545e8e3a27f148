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
 * NOAA Climate Data Online v2 {@code data} endpoint. Requires the CDO token as the source's API key.
 *
 * <p>Parameters: {@code stationid} (e.g. {@code GHCND:USW00094728}), {@code datasetid}
 * (default {@code GHCND}), optional {@code datatypeid}, {@code units} (default {@code metric}),
 * {@code limit} (default {@value #DEFAULT_LIMIT}) and the usual date window.
 *
 * <p>Output is long-format, one row per observation: {@code timestamp}, {@code station},
 * {@code datatype}, {@code value}. An empty response ({@code {}}) is an empty dataset.
 */
@Component
public class NoaaClimateFetcher extends AbstractHttpSourceFetcher {

    static final int DEFAULT_LIMIT = 1000;

    public NoaaClimateFetcher(SourceRegistry registry, WebClient.Builder builder,
                              ObjectMapper objectMapper, Clock clock) {
        super(SourceIds.NOAA_CLIMATE, registry, builder, objectMapper, clock);
    }

    @Override
    protected Mono<String> request(Map<String, Object> parameters) {
        if (!descriptor.hasApiKey()) {
            return Mono.error(new SourceFetchException(sourceId(), "NOAA CDO token is not configured"));
        }
        DateWindow window = window(parameters);
        String station = requireParam(parameters, "stationid");
        String dataset = param(parameters, "datasetid").orElse("GHCND");
        String units = param(parameters, "units").orElse("metric");
        String limit = param(parameters, "limit").orElse(String.valueOf(DEFAULT_LIMIT));
        String datatype = param(parameters, "datatypeid").orElse(null);

        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path("/cdo-web/api/v2/data")
                    .queryParam("datasetid", dataset)
                    .queryParam("stationid", station)
                    .queryParam("startdate", window.start())
                    .queryParam("enddate", window.end())
                    .queryParam("units", units)
                    .queryParam("limit", limit);
                if (datatype != null) {
                    uriBuilder.queryParam("datatypeid", datatype);
                }
                return uriBuilder.build();
            })
            .header("token", descriptor.apiKey())
            .retrieve()
            .bodyToMono(String.class);
    }

    @Override
    protected TabularDataset normalize(JsonNode body, Map<String, Object> parameters) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode result : body.path("results")) {
            String date = text(result.path("date"));
            if (date == null) continue;
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Timestamps.parse(date));
            row.put("station", text(result.path("station")));
            row.put("datatype", text(result.path("datatype")));
            row.put("value", number(result.path("value"), null));
            rows.add(row);
        }
        // stable: observations of one day keep the API's datatype order
        rows.sort(Comparator.comparing(row -> (Instant) row.get("timestamp")));

        return TabularDataset.builder()
            .column("timestamp", ColumnType.TIMESTAMP)
            .column("station", ColumnType.STRING)
            .column("datatype", ColumnType.STRING)
            .column("value", ColumnType.NUMERIC)
            .rows(rows)
            .build();
    }
}
