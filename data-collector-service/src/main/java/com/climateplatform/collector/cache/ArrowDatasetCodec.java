package com.climateplatform.collector.cache;

import com.climateplatform.common.dataset.Column;
import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeStampMicroTZVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.IOException;
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes a {@link TabularDataset} as an Arrow IPC file and back.
 *
 * <p>The file is self-describing: column names and types live in the Arrow schema
 * ({@code Float8} numeric, {@code Utf8} string, {@code Timestamp(MICROSECOND, UTC)} timestamp) and
 * caller-supplied metadata rides along as schema custom metadata. Timestamps keep the microsecond
 * precision datasets hold them at; files written with another timestamp unit are still readable.
 * Rows are written in record batches of {@value #BATCH_SIZE}.
 */
final class ArrowDatasetCodec {

    static final int BATCH_SIZE = 4096;

    private static final ArrowType NUMERIC_TYPE = new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    private static final ArrowType STRING_TYPE = new ArrowType.Utf8();
    private static final ArrowType TIMESTAMP_TYPE = new ArrowType.Timestamp(TimeUnit.MICROSECOND, "UTC");

    private ArrowDatasetCodec() {}

    record Decoded(TabularDataset dataset, Map<String, String> metadata) {}

    static void write(TabularDataset dataset, Map<String, String> metadata,
                      WritableByteChannel channel, BufferAllocator allocator) throws IOException {
        List<Field> fields = new ArrayList<>(dataset.columns().size());
        for (Column column : dataset.columns()) {
            fields.add(new Field(column.name(), FieldType.nullable(arrowType(column.type())), null));
        }
        Schema schema = new Schema(fields, metadata);
        List<Map<String, Object>> rows = dataset.rows();

        try (VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
             ArrowFileWriter writer = new ArrowFileWriter(root, null, channel)) {
            writer.start();
            for (int offset = 0; offset < rows.size(); offset += BATCH_SIZE) {
                int count = Math.min(BATCH_SIZE, rows.size() - offset);
                root.allocateNew();
                for (int c = 0; c < dataset.columns().size(); c++) {
                    Column column = dataset.columns().get(c);
                    FieldVector vector = root.getVector(c);
                    for (int i = 0; i < count; i++) {
                        setCell(vector, column.type(), i, rows.get(offset + i).get(column.name()));
                    }
                }
                root.setRowCount(count);
                writer.writeBatch();
            }
            writer.end();
        }
    }

    static Decoded read(SeekableByteChannel channel, BufferAllocator allocator) throws IOException {
        try (ArrowFileReader reader = new ArrowFileReader(channel, allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            Schema schema = root.getSchema();

            List<Column> columns = new ArrayList<>(schema.getFields().size());
            for (Field field : schema.getFields()) {
                columns.add(Column.of(field.getName(), columnType(field)));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            while (reader.loadNextBatch()) {
                for (int i = 0; i < root.getRowCount(); i++) {
                    Map<String, Object> row = new LinkedHashMap<>();
                    for (int c = 0; c < columns.size(); c++) {
                        Column column = columns.get(c);
                        row.put(column.name(), getCell(root.getVector(c), column.type(), i));
                    }
                    rows.add(row);
                }
            }
            Map<String, String> metadata = schema.getCustomMetadata() == null ? Map.of() : schema.getCustomMetadata();
            return new Decoded(new TabularDataset(columns, rows), metadata);
        }
    }

    private static ArrowType arrowType(ColumnType type) {
        return switch (type) {
            case NUMERIC   -> NUMERIC_TYPE;
            case TIMESTAMP -> TIMESTAMP_TYPE;
            case STRING    -> STRING_TYPE;
        };
    }

    private static ColumnType columnType(Field field) {
        ArrowType type = field.getType();
        if (type instanceof ArrowType.FloatingPoint) return ColumnType.NUMERIC;
        if (type instanceof ArrowType.Utf8) return ColumnType.STRING;
        if (type instanceof ArrowType.Timestamp) return ColumnType.TIMESTAMP;
        throw new IllegalStateException("Unsupported Arrow type " + type + " for column " + field.getName());
    }

    private static void setCell(FieldVector vector, ColumnType type, int index, Object value) {
        switch (type) {
            case NUMERIC -> {
                Float8Vector v = (Float8Vector) vector;
                if (value == null) v.setNull(index); else v.setSafe(index, (Double) value);
            }
            case TIMESTAMP -> {
                TimeStampMicroTZVector v = (TimeStampMicroTZVector) vector;
                if (value == null) v.setNull(index); else v.setSafe(index, toEpochMicros((Instant) value));
            }
            case STRING -> {
                VarCharVector v = (VarCharVector) vector;
                if (value == null) v.setNull(index); else v.setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
            }
        }
    }

    private static Object getCell(FieldVector vector, ColumnType type, int index) {
        if (vector.isNull(index)) return null;
        return switch (type) {
            case NUMERIC   -> ((Float8Vector) vector).get(index);
            case TIMESTAMP -> toInstant(((TimeStampVector) vector).get(index),
                                        ((ArrowType.Timestamp) vector.getField().getType()).getUnit());
            case STRING    -> new String(((VarCharVector) vector).get(index), StandardCharsets.UTF_8);
        };
    }

    private static long toEpochMicros(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }

    private static Instant toInstant(long value, TimeUnit unit) {
        return switch (unit) {
            case SECOND      -> Instant.ofEpochSecond(value);
            case MILLISECOND -> Instant.ofEpochMilli(value);
            case MICROSECOND -> Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000L),
                                                      Math.floorMod(value, 1_000_000L) * 1_000L);
            case NANOSECOND  -> Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000_000L),
                                                      Math.floorMod(value, 1_000_000_000L));
        };
    }
}
