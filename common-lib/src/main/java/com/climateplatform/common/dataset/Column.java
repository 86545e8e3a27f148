package com.climateplatform.common.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record Column(
    @JsonProperty("name") String name,
    @JsonProperty("type") ColumnType type
) {
    public Column {
        Objects.requireNonNull(name, "column name");
        Objects.requireNonNull(type, "column type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("column name must not be blank");
        }
    }

    public static Column of(String name, ColumnType type) {
        return new Column(name, type);
    }
}
