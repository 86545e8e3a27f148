package com.climateplatform.common.dataset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TabularDatasetTest {

    private static final Instant DAY_1 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2024-01-02T00:00:00Z");

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    @Nested
    @DisplayName("builder()")
    class BuilderTests {

        @Test
        @DisplayName("infers column types from first non-null value")
        void infersTypes() {
            TabularDataset ds = TabularDataset.builder()
                .row(row("timestamp", DAY_1, "station", null, "value", 1))
                .row(row("timestamp", DAY_2, "station", "OTTAWA", "value", 2.5))
                .build();

            assertEquals(List.of(
                Column.of("timestamp", ColumnType.TIMESTAMP),
                Column.of("station", ColumnType.STRING),
                Column.of("value", ColumnType.NUMERIC)), ds.columns());
            assertEquals(Arrays.asList(1.0, 2.5), ds.values("value"));
        }

        @Test
        @DisplayName("all-null column → STRING")
        void allNullColumn_isString() {
            TabularDataset ds = TabularDataset.builder()
                .row(row("note", null))
                .build();
            assertEquals(ColumnType.STRING, ds.column("note").orElseThrow().type());
        }

        @Test
        @DisplayName("mixed inferred types → IllegalArgumentException")
        void mixedTypes_rejected() {
            TabularDataset.Builder builder = TabularDataset.builder()
                .row(row("value", 1.0))
                .row(row("value", "high"));
            assertThrows(IllegalArgumentException.class, builder::build);
        }

        @Test
        @DisplayName("rows missing a column get null cells")
        void missingCells_areNull() {
            TabularDataset ds = TabularDataset.builder()
                .row(row("a", 1.0))
                .row(row("b", "x"))
                .build();
            assertNull(ds.rows().get(0).get("b"));
            assertNull(ds.rows().get(1).get("a"));
            assertTrue(ds.rows().get(0).containsKey("b"));
        }

        @Test
        @DisplayName("declared column coerces integers to Double")
        void declaredColumn_coerces() {
            TabularDataset ds = TabularDataset.builder()
                .column("value", ColumnType.NUMERIC)
                .row(row("value", 7L))
                .build();
            assertEquals(7.0, ds.rows().get(0).get("value"));
        }
    }

    @Nested
    @DisplayName("construction invariants")
    class InvariantTests {

        @Test
        @DisplayName("duplicate column names rejected")
        void duplicateColumns() {
            List<Column> columns = List.of(Column.of("a", ColumnType.NUMERIC), Column.of("a", ColumnType.STRING));
            assertThrows(IllegalArgumentException.class, () -> new TabularDataset(columns, List.of()));
        }

        @Test
        @DisplayName("row with undeclared column rejected")
        void undeclaredColumn() {
            List<Column> columns = List.of(Column.of("a", ColumnType.NUMERIC));
            List<Map<String, Object>> rows = List.of(row("b", 1.0));
            assertThrows(IllegalArgumentException.class, () -> new TabularDataset(columns, rows));
        }

        @Test
        @DisplayName("rows are immutable and detached from the input")
        void rowsImmutable() {
            Map<String, Object> source = new HashMap<>(row("a", 1.0));
            TabularDataset ds = new TabularDataset(List.of(Column.of("a", ColumnType.NUMERIC)), List.of(source));
            source.put("a", 99.0);

            assertEquals(1.0, ds.rows().get(0).get("a"));
            assertThrows(UnsupportedOperationException.class, () -> ds.rows().get(0).put("a", 2.0));
            assertThrows(UnsupportedOperationException.class, () -> ds.rows().add(Map.of()));
        }

        @Test
        @DisplayName("equal content → equal datasets")
        void valueEquality() {
            TabularDataset a = TabularDataset.builder().row(row("t", DAY_1, "v", 1)).build();
            TabularDataset b = TabularDataset.builder().row(row("t", DAY_1, "v", 1.0)).build();
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("timestamps are held at microsecond precision")
        void timestampsTruncatedToMicros() {
            TabularDataset ds = TabularDataset.builder()
                .row(row("t", Instant.parse("2024-01-05T12:00:00.123456789Z")))
                .build();
            assertEquals(Instant.parse("2024-01-05T12:00:00.123456Z"), ds.rows().get(0).get("t"));
        }

        @Test
        @DisplayName("empty() has no rows and no columns")
        void emptyDataset() {
            assertTrue(TabularDataset.empty().isEmpty());
            assertEquals(0, TabularDataset.empty().rowCount());
            assertTrue(TabularDataset.empty().columns().isEmpty());
        }
    }

    @Nested
    @DisplayName("concat()")
    class ConcatTests {

        @Test
        @DisplayName("preserves row order and unions columns in first-seen order")
        void unionAndOrder() {
            TabularDataset first = TabularDataset.builder().row(row("timestamp", DAY_1, "value", 1.0)).build();
            TabularDataset second = TabularDataset.builder().row(row("timestamp", DAY_2, "station", "X")).build();

            TabularDataset merged = TabularDataset.concat(List.of(first, second));

            assertEquals(List.of("timestamp", "value", "station"),
                merged.columns().stream().map(Column::name).toList());
            assertEquals(List.of(DAY_1, DAY_2), merged.values("timestamp"));
            assertNull(merged.rows().get(0).get("station"));
            assertNull(merged.rows().get(1).get("value"));
        }

        @Test
        @DisplayName("all-null column in one part takes the type of the part that has values")
        void allNullPartAdoptsOtherType() {
            Map<String, Object> nullCell = new HashMap<>();
            nullCell.put("air_temp", null);
            TabularDataset quiet = TabularDataset.builder().row(nullCell).build();
            TabularDataset measured = TabularDataset.builder().row(row("air_temp", -4.0)).build();
            assertEquals(ColumnType.STRING, quiet.column("air_temp").orElseThrow().type());

            TabularDataset merged = TabularDataset.concat(List.of(quiet, measured));

            assertEquals(ColumnType.NUMERIC, merged.column("air_temp").orElseThrow().type());
            assertEquals(Arrays.asList(null, -4.0), merged.values("air_temp"));
        }

        @Test
        @DisplayName("numeric and string values for one column → string column, values stringified")
        void conflictingTypesWidenToString() {
            TabularDataset numeric = TabularDataset.builder().row(row("v", 1.5)).build();
            TabularDataset text = TabularDataset.builder().row(row("v", "a")).build();

            TabularDataset merged = TabularDataset.concat(List.of(numeric, text));

            assertEquals(ColumnType.STRING, merged.column("v").orElseThrow().type());
            assertEquals(List.of("1.5", "a"), merged.values("v"));
        }

        @Test
        @DisplayName("column null in every part keeps its first declared type")
        void allNullEverywhere() {
            Map<String, Object> nullCell = new HashMap<>();
            nullCell.put("v", null);
            TabularDataset first = TabularDataset.builder().column("v", ColumnType.NUMERIC).row(nullCell).build();
            TabularDataset second = TabularDataset.builder().row(nullCell).build();

            TabularDataset merged = TabularDataset.concat(List.of(first, second));

            assertEquals(ColumnType.NUMERIC, merged.column("v").orElseThrow().type());
            assertEquals(2, merged.rowCount());
        }

        @Test
        @DisplayName("no parts → empty dataset")
        void noParts() {
            assertSame(TabularDataset.empty(), TabularDataset.concat(List.of()));
        }
    }

    @Test
    @DisplayName("values() of an unknown column → IllegalArgumentException")
    void valuesUnknownColumn() {
        assertThrows(IllegalArgumentException.class, () -> TabularDataset.empty().values("missing"));
    }
}
