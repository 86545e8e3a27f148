package com.climateplatform.common.dataset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered table of typed rows: the unit of data exchanged by every collector component.
 *
 * <p>Every row carries exactly the declared columns (absent cells are stored as {@code null}) and
 * every cell is coerced into its column's canonical type at construction time, so two datasets
 * built from the same logical content compare equal row-for-row regardless of how they were made.
 *
 * <p>Instances are never mutated after construction: the column list and every row map are
 * unmodifiable copies.
 */
public record TabularDataset(
    @JsonProperty("columns") List<Column> columns,
    @JsonProperty("rows") List<Map<String, Object>> rows
) {

    private static final TabularDataset EMPTY = new TabularDataset(List.of(), List.of());

    public TabularDataset {
        columns = List.copyOf(columns == null ? List.of() : columns);
        Map<String, Column> byName = new LinkedHashMap<>();
        for (Column column : columns) {
            if (byName.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column: " + column.name());
            }
        }
        List<Map<String, Object>> normalized = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                normalized.add(normalizeRow(row, byName));
            }
        }
        rows = Collections.unmodifiableList(normalized);
    }

    public static TabularDataset empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Concatenates datasets in order. The result's columns are the union of the inputs' columns in
     * first-seen order; cells for columns a part does not carry are {@code null}.
     *
     * <p>A column's type comes from the parts that hold at least one non-null value in it, so a
     * column that is entirely null in one part takes its type from the others. When those parts
     * still disagree the column becomes {@link ColumnType#STRING} and its values are stringified.
     */
    public static TabularDataset concat(List<TabularDataset> parts) {
        if (parts == null || parts.isEmpty()) return EMPTY;
        if (parts.size() == 1) return parts.get(0);

        Map<String, ColumnType> declared = new LinkedHashMap<>();
        Map<String, ColumnType> observed = new LinkedHashMap<>();
        for (TabularDataset part : parts) {
            for (Column column : part.columns()) {
                declared.putIfAbsent(column.name(), column.type());
                if (part.hasValues(column.name())) {
                    observed.merge(column.name(), column.type(),
                        (a, b) -> a == b ? a : ColumnType.STRING);
                }
            }
        }

        List<Column> union = new ArrayList<>(declared.size());
        declared.forEach((name, type) -> union.add(Column.of(name, observed.getOrDefault(name, type))));

        List<Map<String, Object>> allRows = new ArrayList<>();
        for (TabularDataset part : parts) {
            for (Map<String, Object> row : part.rows()) {
                allRows.add(widen(row, union));
            }
        }
        return new TabularDataset(union, allRows);
    }

    private boolean hasValues(String columnName) {
        for (Map<String, Object> row : rows) {
            if (row.get(columnName) != null) return true;
        }
        return false;
    }

    private static Map<String, Object> widen(Map<String, Object> row, List<Column> columns) {
        Map<String, Object> copy = new LinkedHashMap<>(row);
        for (Column column : columns) {
            Object value = copy.get(column.name());
            if (column.type() == ColumnType.STRING && value != null && !(value instanceof String)) {
                copy.put(column.name(), value.toString());
            }
        }
        return copy;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @JsonProperty("rowCount")
    public int rowCount() {
        return rows.size();
    }

    public Optional<Column> column(String name) {
        return columns.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /** Returns the values of one column in row order. */
    public List<Object> values(String columnName) {
        if (column(columnName).isEmpty()) {
            throw new IllegalArgumentException("Unknown column: " + columnName);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(columnName));
        }
        return values;
    }

    private static Map<String, Object> normalizeRow(Map<String, Object> row, Map<String, Column> byName) {
        for (String key : row.keySet()) {
            if (!byName.containsKey(key)) {
                throw new IllegalArgumentException("Row has undeclared column: " + key);
            }
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Column column : byName.values()) {
            copy.put(column.name(), column.type().coerce(row.get(column.name())));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Collects rows and columns for a new dataset. Columns may be declared up front; any row key
     * that was not declared becomes a column typed after its first non-null value
     * ({@link ColumnType#STRING} when every value is null).
     */
    public static final class Builder {

        private final Map<String, ColumnType> declared = new LinkedHashMap<>();
        private final List<Map<String, Object>> rows = new ArrayList<>();

        private Builder() {}

        public Builder column(String name, ColumnType type) {
            declared.put(name, type);
            return this;
        }

        public Builder row(Map<String, ?> row) {
            rows.add(new LinkedHashMap<>(row));
            return this;
        }

        public Builder rows(List<? extends Map<String, ?>> rows) {
            rows.forEach(this::row);
            return this;
        }

        public TabularDataset build() {
            Map<String, ColumnType> types = new LinkedHashMap<>(declared);
            for (Map<String, Object> row : rows) {
                for (Map.Entry<String, Object> cell : row.entrySet()) {
                    Object value = cell.getValue();
                    ColumnType known = types.get(cell.getKey());
                    if (known == null) {
                        // a column seen only with nulls so far takes the type of its next non-null value
                        types.put(cell.getKey(), value == null ? null : ColumnType.infer(value));
                    } else if (!declared.containsKey(cell.getKey()) && value != null
                               && known != ColumnType.infer(value)) {
                        throw new IllegalArgumentException("Column " + cell.getKey() + " mixes "
                            + known + " and " + ColumnType.infer(value) + " values");
                    }
                }
            }
            List<Column> columns = new ArrayList<>(types.size());
            types.forEach((name, type) -> columns.add(Column.of(name, type == null ? ColumnType.STRING : type)));
            return new TabularDataset(columns, rows);
        }
    }
}
