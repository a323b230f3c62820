package com.media.resolution.crosswalk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.media.resolution.core.model.CatalogService;
import com.media.resolution.core.model.MediaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Crosswalk records keyed by {@code "{service}_{kind}_{id}"}, persisted as one JSON file.
 *
 * <p>The file is read once on construction; a missing or unreadable file starts an
 * empty cache. {@link #save()} writes only when something was added since the last save.
 * One instance can be shared by passes running on different threads.</p>
 */
public class CrosswalkCache {
    private static final Logger log = LoggerFactory.getLogger(CrosswalkCache.class);

    public static final String FILE_NAME = "mappings.json";

    private static final TypeReference<Map<String, CachedEntry>> ENTRIES_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, CachedEntry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean dirty;

    /**
     * Opens the cache stored in {@code directory}.
     */
    public CrosswalkCache(Path directory) {
        this.file = directory.resolve(FILE_NAME);
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public static String key(CatalogService service, MediaKind kind, int id) {
        return service.getKey() + "_" + kind.getLabel() + "_" + id;
    }

    public Optional<CrosswalkRecord> get(CatalogService service, MediaKind kind, int id) {
        lock.readLock().lock();
        try {
            CachedEntry entry = entries.get(key(service, kind, id));
            return entry == null ? Optional.empty() : Optional.ofNullable(entry.data());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(CatalogService service, MediaKind kind, int id, CrosswalkRecord record) {
        lock.writeLock().lock();
        try {
            entries.put(key(service, kind, id), new CachedEntry(record, Instant.now()));
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isDirty() {
        lock.readLock().lock();
        try {
            return dirty;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getFile() {
        return file;
    }

    /**
     * Writes the cache to disk if it changed since it was loaded or last saved.
     *
     * @return true if the file was written
     * @throws UncheckedIOException if the directory or file cannot be written
     */
    public boolean save() {
        lock.writeLock().lock();
        try {
            if (!dirty) {
                return false;
            }
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), entries);
            dirty = false;
            log.debug("crosswalk.cache.saved file={} entries={}", file, entries.size());
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("write crosswalk cache " + file, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            Map<String, CachedEntry> loaded = objectMapper.readValue(file.toFile(), ENTRIES_TYPE);
            if (loaded != null) {
                entries.putAll(loaded);
            }
            log.debug("crosswalk.cache.loaded file={} entries={}", file, entries.size());
        } catch (IOException e) {
            log.warn("crosswalk.cache.unreadable file={} error={}; starting empty", file, e.getMessage());
        }
    }

    /**
     * One cached lookup result and when it was stored.
     */
    public record CachedEntry(
            @JsonProperty("data") CrosswalkRecord data,
            @JsonProperty("cached_at") Instant cachedAt
    ) {
    }
}
