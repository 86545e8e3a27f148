package com.climateplatform.collector.processing;

import com.climateplatform.common.dataset.Column;
import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Quality checks over a dataset, one named boolean per check.
 *
 * <p>{@value #HAS_REQUIRED_COLUMNS} checks the caller's required columns, by default the
 * {@code timestamp} column every fetcher emits. {@value #DATA_TYPES_VALID} rejects NaN and infinite
 * numeric cells. {@value #VALUE_RANGES_VALID} is the conjunction of the per-column range checks.
 */
public final class DatasetValidator {

    public static final String HAS_DATA = "has_data";
    public static final String HAS_REQUIRED_COLUMNS = "has_required_columns";
    public static final String NO_MISSING_VALUES = "no_missing_values";
    public static final String NO_DUPLICATES = "no_duplicates";
    public static final String DATA_TYPES_VALID = "data_types_valid";
    public static final String VALUE_RANGES_VALID = "value_ranges_valid";
    public static final String VALID_RANGE_SUFFIX = "_has_valid_range";

    public static final Set<String> DEFAULT_REQUIRED_COLUMNS = Set.of("timestamp");

    static final double RANGE_LIMIT = 1e6;

    private DatasetValidator() {}

    public static Map<String, Boolean> validate(TabularDataset dataset) {
        return validate(dataset, DEFAULT_REQUIRED_COLUMNS);
    }

    public static Map<String, Boolean> validate(TabularDataset dataset, Collection<String> requiredColumns) {
        List<Map<String, Object>> rows = dataset.rows();
        Map<String, Boolean> results = new LinkedHashMap<>();
        results.put(HAS_DATA, !rows.isEmpty());
        results.put(HAS_REQUIRED_COLUMNS,
            requiredColumns.stream().allMatch(name -> dataset.column(name).isPresent()));
        results.put(NO_MISSING_VALUES, rows.stream().noneMatch(row -> row.containsValue(null)));
        results.put(NO_DUPLICATES, new HashSet<>(rows).size() == rows.size());

        boolean typesValid = true;
        boolean rangesValid = true;
        Map<String, Boolean> perColumn = new LinkedHashMap<>();
        for (Column column : dataset.columns()) {
            if (column.type() == ColumnType.NUMERIC) {
                List<Object> values = dataset.values(column.name());
                typesValid &= allFinite(values);
                boolean inRange = withinRange(values);
                rangesValid &= inRange;
                perColumn.put(column.name() + VALID_RANGE_SUFFIX, inRange);
            }
        }
        results.put(DATA_TYPES_VALID, typesValid);
        results.put(VALUE_RANGES_VALID, rangesValid);
        results.putAll(perColumn);
        return results;
    }

    private static boolean allFinite(List<Object> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .allMatch(v -> Double.isFinite(((Number) v).doubleValue()));
    }

    // a column with no values at all has no valid range
    private static boolean withinRange(List<Object> values) {
        List<Double> present = values.stream()
            .filter(Objects::nonNull)
            .map(v -> ((Number) v).doubleValue())
            .toList();
        return !present.isEmpty()
            && present.stream().allMatch(v -> v >= -RANGE_LIMIT && v <= RANGE_LIMIT);
    }
}
