package com.climateplatform.collector.dto;

import com.climateplatform.common.dataset.TabularDataset;
import com.fasterxml.jackson.annotation.JsonProperty;

public record ClimateDataResponse(
    @JsonProperty("status")  String         status,
    @JsonProperty("source")  String         source,
    @JsonProperty("dataset") TabularDataset dataset
) {
    public static ClimateDataResponse success(String source, TabularDataset dataset) {
        return new ClimateDataResponse("success", source, dataset);
    }
}
