package com.climateplatform.collector.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ValidationResponse(
    @JsonProperty("source")     String               source,
    @JsonProperty("rowCount")   int                  rowCount,
    @JsonProperty("valid")      boolean              valid,      // every check passed
    @JsonProperty("validation") Map<String, Boolean> validation
) {}
