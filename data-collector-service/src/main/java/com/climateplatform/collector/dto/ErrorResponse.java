package com.climateplatform.collector.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ErrorResponse(
    @JsonProperty("status")    int     status,
    @JsonProperty("error")     String  error,
    @JsonProperty("source")    String  source,
    @JsonProperty("message")   String  message,
    @JsonProperty("traceId")   String  traceId,
    @JsonProperty("timestamp") Instant timestamp
) {}
