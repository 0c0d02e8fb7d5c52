package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.StoreUnavailableException;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.domain.VersionConflictException;
import com.streamfirst.seed.domain.VersionedValue;
import com.streamfirst.seed.ports.KeyValuePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of KeyValuePort for testing and development.
 * Every write issues a fresh version tag, and conditional writes are checked and applied
 * atomically, so one instance can be shared by several coordinators to simulate a cluster.
 * Data is lost when the application stops - not suitable for production use.
 */
@Slf4j
public class InMemoryKeyValueAdapter implements KeyValuePort {

    // collection -> key -> value
    private final Map<String, Map<String, VersionedValue>> collections = new HashMap<>();
    private final AtomicLong versionSequence = new AtomicLong();
    private final AtomicLong writeCount = new AtomicLong();
    private final Clock clock;

    private volatile boolean available = true;

    public InMemoryKeyValueAdapter() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<VersionedValue> get(String collection, String key) {
        checkAvailable();
        Map<String, VersionedValue> values = collections.get(collection);
        VersionedValue value = values == null ? null : values.get(key);
        log.debug("Read {}/{}: {}", collection, key, value == null ? "not found" : value.version());
        return Optional.ofNullable(value);
    }

    @Override
    public synchronized VersionedValue upsert(String collection, String key, String data, Version expected) {
        Objects.requireNonNull(expected, "Expected version cannot be null, use Version.ABSENT to create only");
        checkAvailable();
        Map<String, VersionedValue> values = collections.computeIfAbsent(collection, k -> new HashMap<>());
        VersionedValue current = values.get(key);

        if (!expected.accepts(current == null ? null : current.version())) {
            log.debug("Rejected write to {}/{}: expected {}, found {}",
                     collection, key, expected, current == null ? "nothing" : current.version());
            throw new VersionConflictException(collection, key, expected);
        }

        VersionedValue updated = new VersionedValue(
            collection, key, data, Version.of(Long.toString(versionSequence.incrementAndGet())), clock.instant());
        values.put(key, updated);
        writeCount.incrementAndGet();

        log.debug("Wrote {}/{} at version {}", collection, key, updated.version());
        return updated;
    }

    @Override
    public synchronized void delete(String collection, String key, Version expected) {
        Objects.requireNonNull(expected, "Expected version cannot be null, use Version.ANY to delete unconditionally");
        checkAvailable();
        Map<String, VersionedValue> values = collections.get(collection);
        VersionedValue current = values == null ? null : values.get(key);
        if (current == null) {
            return;
        }

        if (!expected.accepts(current.version())) {
            log.debug("Rejected delete of {}/{}: expected {}, found {}",
                     collection, key, expected, current.version());
            throw new VersionConflictException(collection, key, expected);
        }

        values.remove(key);
        writeCount.incrementAndGet();
        log.debug("Deleted {}/{}", collection, key);
    }

    /**
     * Simulates the backing service going away (or coming back).
     */
    public void setAvailable(boolean available) {
        log.info("Key/value store is now {}", available ? "available" : "unavailable");
        this.available = available;
    }

    /**
     * Number of successful writes and deletes since creation.
     */
    public long getWriteCount() {
        return writeCount.get();
    }

    /**
     * Clears all stored values. Useful for testing.
     */
    public synchronized void clear() {
        log.info("Clearing all key/value data");
        collections.clear();
    }

    private void checkAvailable() {
        if (!available) {
            throw new StoreUnavailableException("Key/value store is unavailable");
        }
    }
}
