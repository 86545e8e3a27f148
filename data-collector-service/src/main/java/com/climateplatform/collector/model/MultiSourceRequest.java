package com.climateplatform.collector.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record MultiSourceRequest(
    @JsonProperty("sources") List<String> sources,
    @JsonProperty("parameters") Map<String, Object> parameters
) {
    public MultiSourceRequest {
        sources = sources == null ? List.of() : List.copyOf(sources);
        parameters = parameters == null ? Map.of() : parameters;
    }
}
