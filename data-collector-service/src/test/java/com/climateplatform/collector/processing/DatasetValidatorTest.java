package com.climateplatform.collector.processing;

import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DatasetValidatorTest {

    private static final Instant DAY = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("clean dataset passes every check")
    void cleanDataset() {
        TabularDataset ds = TabularDataset.builder()
            .row(Map.of("timestamp", DAY, "station", "a", "value", 1.0))
            .row(Map.of("timestamp", DAY.plusSeconds(86_400), "station", "b", "value", -2.0))
            .build();

        Map<String, Boolean> result = DatasetValidator.validate(ds);

        assertEquals(Map.of("has_data", true, "has_required_columns", true, "no_missing_values", true,
                            "no_duplicates", true, "data_types_valid", true, "value_ranges_valid", true,
                            "value_has_valid_range", true), result);
    }

    @Test
    @DisplayName("nulls, duplicates and out-of-range values are flagged")
    void flagsProblems() {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("station", null);
        withNull.put("value", 1.0);
        TabularDataset ds = TabularDataset.builder()
            .column("station", ColumnType.STRING)
            .row(Map.of("station", "a", "value", 2e6))
            .row(Map.of("station", "a", "value", 2e6))
            .row(withNull)
            .build();

        Map<String, Boolean> result = DatasetValidator.validate(ds);

        assertTrue(result.get("has_data"));
        assertFalse(result.get("no_missing_values"));
        assertFalse(result.get("no_duplicates"));
        assertFalse(result.get("value_has_valid_range"));
        assertFalse(result.get("value_ranges_valid"));
        assertFalse(result.get("has_required_columns"));
    }

    @Test
    @DisplayName("NaN and infinite readings fail data_types_valid")
    void nonFiniteValues() {
        TabularDataset ds = TabularDataset.builder()
            .row(Map.of("timestamp", DAY, "value", Double.NaN))
            .row(Map.of("timestamp", DAY.plusSeconds(86_400), "value", Double.POSITIVE_INFINITY))
            .build();

        Map<String, Boolean> result = DatasetValidator.validate(ds);

        assertFalse(result.get("data_types_valid"));
        assertTrue(result.get("has_required_columns"));
    }

    @Test
    @DisplayName("caller-supplied required columns are checked")
    void customRequiredColumns() {
        TabularDataset ds = TabularDataset.builder()
            .row(Map.of("station", "a", "value", 1.0))
            .build();

        assertTrue(DatasetValidator.validate(ds, Set.of("station", "value")).get("has_required_columns"));
        assertFalse(DatasetValidator.validate(ds, Set.of("station", "precip")).get("has_required_columns"));
        assertTrue(DatasetValidator.validate(ds, Set.of()).get("has_required_columns"));
    }

    @Test
    @DisplayName("no numeric columns → value_ranges_valid true")
    void noNumericColumns() {
        TabularDataset ds = TabularDataset.builder().row(Map.of("timestamp", DAY, "station", "a")).build();
        assertTrue(DatasetValidator.validate(ds).get("value_ranges_valid"));
    }

    @Test
    @DisplayName("empty dataset → has_data false")
    void emptyDataset() {
        Map<String, Boolean> result = DatasetValidator.validate(TabularDataset.empty());
        assertFalse(result.get("has_data"));
        assertTrue(result.get("no_duplicates"));
    }

    @Test
    @DisplayName("only numeric columns get a range check")
    void rangeChecksNumericOnly() {
        TabularDataset ds = TabularDataset.builder()
            .column("station", ColumnType.STRING)
            .column("t", ColumnType.NUMERIC)
            .rows(List.of(Map.of("station", "x", "t", 1e6)))
            .build();

        Map<String, Boolean> result = DatasetValidator.validate(ds);

        assertTrue(result.get("t_has_valid_range"));
        assertFalse(result.containsKey("station_has_valid_range"));
    }
}
