package com.climateplatform.collector.processing;

import com.climateplatform.common.dataset.Column;
import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a raw fetched dataset into an analysis-ready one.
 *
 * <ol>
 *   <li>Duplicate rows are dropped, first occurrence kept.</li>
 *   <li>Null numeric cells take the column mean; null string cells become {@value #MISSING_LABEL}.</li>
 *   <li>Rows outside {@code [Q1 - 1.5*IQR, Q3 + 1.5*IQR]} of any numeric column are dropped,
 *       one column at a time in column order.</li>
 *   <li>Numeric columns are z-score normalized with the sample standard deviation.</li>
 * </ol>
 *
 * Timestamp columns pass through untouched. The input is never modified.
 */
public final class DatasetPreprocessor {

    public static final String MISSING_LABEL = "unknown";

    private static final double IQR_FACTOR = 1.5;

    private DatasetPreprocessor() {}

    public static TabularDataset clean(TabularDataset dataset) {
        if (dataset.isEmpty()) {
            return dataset;
        }
        List<Map<String, Object>> rows = mutableCopy(new ArrayList<>(new LinkedHashSet<>(dataset.rows())));
        List<Column> numeric = dataset.columns().stream()
            .filter(c -> c.type() == ColumnType.NUMERIC)
            .toList();

        fillMissing(dataset.columns(), rows);
        for (Column column : numeric) {
            rows = dropOutliers(column.name(), rows);
        }
        for (Column column : numeric) {
            normalize(column.name(), rows);
        }
        return new TabularDataset(dataset.columns(), rows);
    }

    private static void fillMissing(List<Column> columns, List<Map<String, Object>> rows) {
        for (Column column : columns) {
            Object fill = switch (column.type()) {
                case NUMERIC -> mean(numbers(column.name(), rows));
                case STRING -> MISSING_LABEL;
                case TIMESTAMP -> null;
            };
            if (fill == null) continue;
            for (Map<String, Object> row : rows) {
                if (row.get(column.name()) == null) {
                    row.put(column.name(), fill);
                }
            }
        }
    }

    private static List<Map<String, Object>> dropOutliers(String column, List<Map<String, Object>> rows) {
        double[] sorted = numbers(column, rows);
        if (sorted.length == 0) {
            return rows;
        }
        Arrays.sort(sorted);
        double q1 = quantile(sorted, 0.25);
        double q3 = quantile(sorted, 0.75);
        double iqr = q3 - q1;
        double low = q1 - IQR_FACTOR * iqr;
        double high = q3 + IQR_FACTOR * iqr;
        List<Map<String, Object>> kept = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                kept.add(row);
                continue;
            }
            double v = ((Number) value).doubleValue();
            if (v >= low && v <= high) {
                kept.add(row);
            }
        }
        return kept;
    }

    private static void normalize(String column, List<Map<String, Object>> rows) {
        double[] values = numbers(column, rows);
        if (values.length == 0) return;
        double mean = mean(values);
        double std = sampleStd(values, mean);
        for (Map<String, Object> row : rows) {
            Object value = row.get(column);
            if (value == null) continue;
            double v = ((Number) value).doubleValue();
            // constant (or single-value) column: centred, not scaled
            row.put(column, std == 0.0 || Double.isNaN(std) ? 0.0 : (v - mean) / std);
        }
    }

    /** Linear interpolation between closest ranks over an ascending array. */
    static double quantile(double[] sorted, double q) {
        if (sorted.length == 1) return sorted[0];
        double position = (sorted.length - 1) * q;
        int lower = (int) Math.floor(position);
        int upper = Math.min(lower + 1, sorted.length - 1);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static double[] numbers(String column, List<Map<String, Object>> rows) {
        return rows.stream()
            .map(row -> row.get(column))
            .filter(Objects::nonNull)
            .mapToDouble(v -> ((Number) v).doubleValue())
            .toArray();
    }

    private static Double mean(double[] values) {
        if (values.length == 0) return null;
        return Arrays.stream(values).average().orElseThrow();
    }

    private static double sampleStd(double[] values, double mean) {
        if (values.length < 2) return Double.NaN;
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    private static List<Map<String, Object>> mutableCopy(List<Map<String, Object>> rows) {
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            copy.add(new LinkedHashMap<>(row));
        }
        return copy;
    }
}
