package com.climateplatform.collector.cache;

import com.climateplatform.common.dataset.ColumnType;
import com.climateplatform.common.dataset.TabularDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ArrowDatasetCacheStoreTest {

    @TempDir
    Path cacheDir;

    private ArrowDatasetCacheStore store;

    @BeforeEach
    void setUp() {
        store = new ArrowDatasetCacheStore(cacheDir);
    }

    private static TabularDataset sample() {
        Map<String, Object> withNulls = new HashMap<>();
        withNulls.put("timestamp", Instant.parse("2024-01-02T00:00:00Z"));
        withNulls.put("station", null);
        withNulls.put("value", null);
        return TabularDataset.builder()
            .column("timestamp", ColumnType.TIMESTAMP)
            .column("station", ColumnType.STRING)
            .column("value", ColumnType.NUMERIC)
            .row(Map.of("timestamp", Instant.parse("2024-01-01T00:00:00Z"), "station", "OTTAWA CDA", "value", -3.25))
            .row(withNulls)
            .row(Map.of("timestamp", Instant.parse("2024-01-03T12:30:00.123Z"), "station", "Montréal", "value", 1e6))
            .build();
    }

    private List<Path> tempFiles() throws IOException {
        try (Stream<Path> files = Files.list(cacheDir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
        }
    }

    @Nested
    @DisplayName("store() → lookup()")
    class RoundTripTests {

        @Test
        @DisplayName("returns an equal dataset, nulls and fractional timestamps included")
        void roundTrip() {
            CacheKey key = CacheKey.of("s1", Map.of("date", "2024-01-01"));
            TabularDataset dataset = sample();

            assertTrue(store.store(key, dataset));
            Optional<TabularDataset> cached = store.lookup(key);

            assertEquals(Optional.of(dataset), cached);
            assertTrue(Files.isRegularFile(cacheDir.resolve(key.fileName())));
        }

        @Test
        @DisplayName("sub-millisecond and pre-1970 timestamps come back unchanged")
        void fractionalMillisecondTimestamps() {
            TabularDataset dataset = TabularDataset.builder()
                .column("timestamp", ColumnType.TIMESTAMP)
                .row(Map.of("timestamp", Instant.parse("2024-01-05T12:00:00.123456Z")))
                .row(Map.of("timestamp", Instant.parse("1955-06-30T23:59:59.999999Z")))
                .build();
            CacheKey key = CacheKey.of("s1", Map.of("date", "2024-01-05"));

            assertTrue(store.store(key, dataset));

            assertEquals(dataset, store.lookup(key).orElseThrow());
            assertEquals(List.of(Instant.parse("2024-01-05T12:00:00.123456Z"), Instant.parse("1955-06-30T23:59:59.999999Z")),
                         store.lookup(key).orElseThrow().values("timestamp"));
        }

        @Test
        @DisplayName("empty dataset round-trips")
        void emptyRoundTrip() {
            CacheKey key = CacheKey.of("s1", Map.of());
            assertTrue(store.store(key, TabularDataset.empty()));
            assertEquals(Optional.of(TabularDataset.empty()), store.lookup(key));
        }

        @Test
        @DisplayName("datasets larger than one record batch round-trip in order")
        void multiBatch() {
            TabularDataset.Builder builder = TabularDataset.builder();
            int rows = ArrowDatasetCodec.BATCH_SIZE * 2 + 17;
            for (int i = 0; i < rows; i++) {
                builder.row(Map.of("value", (double) i));
            }
            TabularDataset dataset = builder.build();
            CacheKey key = CacheKey.of("s1", Map.of("big", true));

            assertTrue(store.store(key, dataset));
            assertEquals(dataset, store.lookup(key).orElseThrow());
        }

        @Test
        @DisplayName("a second store replaces the entry and leaves no temp files")
        void overwrite() throws IOException {
            CacheKey key = CacheKey.of("s1", Map.of());
            store.store(key, sample());
            TabularDataset replacement = TabularDataset.builder().row(Map.of("value", 1.0)).build();

            assertTrue(store.store(key, replacement));

            assertEquals(replacement, store.lookup(key).orElseThrow());
            assertTrue(tempFiles().isEmpty());
            assertEquals(2, store.stats().writes());
        }
    }

    @Nested
    @DisplayName("lookup() failure handling")
    class LookupFailureTests {

        @Test
        @DisplayName("absent entry → miss")
        void absent() {
            assertTrue(store.lookup(CacheKey.of("s1", Map.of())).isEmpty());
            assertEquals(1, store.stats().misses());
            assertEquals(0, store.stats().corruptEntries());
        }

        @Test
        @DisplayName("garbage bytes → miss, counted as corrupt, never thrown")
        void corruptFile() throws IOException {
            CacheKey key = CacheKey.of("s1", Map.of());
            Files.writeString(store.pathFor(key), "this is not an arrow file");

            assertTrue(store.lookup(key).isEmpty());
            assertEquals(1, store.stats().corruptEntries());
            assertEquals(1, store.stats().misses());
        }

        @Test
        @DisplayName("truncated entry → miss")
        void truncatedFile() throws IOException {
            CacheKey key = CacheKey.of("s1", Map.of());
            store.store(key, sample());
            Path file = store.pathFor(key);
            byte[] bytes = Files.readAllBytes(file);
            Files.write(file, Arrays.copyOf(bytes, bytes.length / 2));

            assertTrue(store.lookup(key).isEmpty());
            assertEquals(1, store.stats().corruptEntries());
        }

        @Test
        @DisplayName("entry stamped with another key → miss")
        void keyMismatch() throws IOException {
            CacheKey written = CacheKey.of("s1", Map.of("date", "2024-01-01"));
            CacheKey requested = CacheKey.of("s1", Map.of("date", "2024-01-02"));
            store.store(written, sample());
            Files.copy(store.pathFor(written), store.pathFor(requested));

            assertTrue(store.lookup(requested).isEmpty());
            assertEquals(1, store.stats().corruptEntries());
        }
    }

    @Nested
    @DisplayName("store() failure handling")
    class StoreFailureTests {

        @Test
        @DisplayName("target path occupied by a non-empty directory → false, counted, no temp left")
        void persistFailure() throws IOException {
            CacheKey key = CacheKey.of("s1", Map.of());
            Path blocker = store.pathFor(key);
            Files.createDirectories(blocker);
            Files.writeString(blocker.resolve("keep"), "x");

            assertFalse(store.store(key, sample()));

            assertEquals(1, store.stats().persistFailures());
            assertEquals(0, store.stats().writes());
            assertTrue(tempFiles().isEmpty());
        }

        @Test
        @DisplayName("recreates a cache directory removed after startup")
        void directoryRemoved() throws IOException {
            Path nested = cacheDir.resolve("nested");
            ArrowDatasetCacheStore nestedStore = new ArrowDatasetCacheStore(nested);
            Files.delete(nested);

            CacheKey key = CacheKey.of("s1", Map.of());
            assertTrue(nestedStore.store(key, sample()));
            assertTrue(nestedStore.lookup(key).isPresent());
        }
    }
}
