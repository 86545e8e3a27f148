package com.climateplatform.collector.cache;

import com.climateplatform.common.dataset.TabularDataset;
import com.climateplatform.common.exception.CachePersistException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * File-backed {@link DatasetCacheStore}: one Arrow IPC file per {@link CacheKey}, named
 * {@code <digest>.arrow}, inside a single directory.
 *
 * <p><strong>Write path:</strong> encode into a temp file in the same directory, then atomically
 * rename it over the final name. Readers therefore only ever see absent or complete entries, and
 * concurrent writers of different keys never touch each other's files.
 *
 * <p><strong>Read path:</strong> anything that prevents a clean decode (truncated file, foreign
 * content, an entry stamped with another key) is logged, counted and reported as a miss. The next
 * successful fetch overwrites the entry.
 *
 * <p>Entries are never expired or evicted here. Files may be deleted externally at any time.
 */
public class ArrowDatasetCacheStore implements DatasetCacheStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ArrowDatasetCacheStore.class);

    static final String META_CACHE_KEY = "climate.cache.key";
    static final String META_SOURCE    = "climate.cache.source";

    private final Path directory;
    private final BufferAllocator allocator;

    private final AtomicLong hits            = new AtomicLong();
    private final AtomicLong misses          = new AtomicLong();
    private final AtomicLong corruptEntries  = new AtomicLong();
    private final AtomicLong writes          = new AtomicLong();
    private final AtomicLong persistFailures = new AtomicLong();

    public ArrowDatasetCacheStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create cache directory " + this.directory, e);
        }
        this.allocator = new RootAllocator();
        log.info("Dataset cache ready. directory={}", this.directory);
    }

    @Override
    public Optional<TabularDataset> lookup(CacheKey key) {
        Path file = pathFor(key);
        if (!Files.isRegularFile(file)) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        try (BufferAllocator child = allocator.newChildAllocator("read-" + key.digest(), 0, Long.MAX_VALUE);
             FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ArrowDatasetCodec.Decoded decoded = ArrowDatasetCodec.read(channel, child);
            String stamped = decoded.metadata().get(META_CACHE_KEY);
            if (!key.digest().equals(stamped)) {
                throw new IllegalStateException("entry is stamped with key " + stamped);
            }
            hits.incrementAndGet();
            return Optional.of(decoded.dataset());
        } catch (NoSuchFileException e) {
            // deleted between the existence check and the open
            misses.incrementAndGet();
            return Optional.empty();
        } catch (IOException | RuntimeException e) {
            corruptEntries.incrementAndGet();
            misses.incrementAndGet();
            log.warn("CACHE_CORRUPT source={} key={} file={} reason={} - treating as miss",
                     key.source(), key.digest(), file, e.toString());
            return Optional.empty();
        }
    }

    @Override
    public boolean store(CacheKey key, TabularDataset dataset) {
        try {
            writeEntry(key, dataset);
            writes.incrementAndGet();
            log.debug("CACHE_STORE source={} key={} rows={}", key.source(), key.digest(), dataset.rowCount());
            return true;
        } catch (CachePersistException e) {
            persistFailures.incrementAndGet();
            log.warn("CACHE_PERSIST_FAILED source={} key={}", key.source(), key.digest(), e);
            return false;
        }
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), corruptEntries.get(), writes.get(), persistFailures.get());
    }

    Path pathFor(CacheKey key) {
        return directory.resolve(key.fileName());
    }

    @Override
    public void close() {
        allocator.close();
    }

    private void writeEntry(CacheKey key, TabularDataset dataset) {
        Path temp = null;
        try {
            // the directory may have been removed externally since startup
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, key.digest() + "-", ".tmp");
            Map<String, String> metadata = Map.of(META_CACHE_KEY, key.digest(), META_SOURCE, key.source());
            try (BufferAllocator child = allocator.newChildAllocator("write-" + key.digest(), 0, Long.MAX_VALUE);
                 FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ArrowDatasetCodec.write(dataset, metadata, channel, child);
            }
            moveIntoPlace(temp, pathFor(key));
        } catch (IOException | RuntimeException e) {
            deleteTemp(temp);
            throw new CachePersistException(key.source(), key.digest(), e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to replace", directory);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("Could not remove temp cache file {}", temp, e);
        }
    }
}
