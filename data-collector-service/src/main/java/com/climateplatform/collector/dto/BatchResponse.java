package com.climateplatform.collector.dto;

import com.climateplatform.common.dataset.TabularDataset;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of a multi-source fetch. Sources that failed are listed, never fatal.
 */
public record BatchResponse(
    @JsonProperty("status")        String                      status,
    @JsonProperty("data")          Map<String, TabularDataset> data,
    @JsonProperty("failedSources") List<String>                failedSources
) {}
