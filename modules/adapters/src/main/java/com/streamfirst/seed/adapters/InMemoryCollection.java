package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.StoreUnavailableException;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.domain.VersionConflictException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Versioned, insertion-ordered in-memory collection shared by the resource store adapters.
 * Supports failing a chosen write so tests can exercise partial-failure paths.
 *
 * @param <T> the stored resource type
 */
@Slf4j
public abstract class InMemoryCollection<T> {

    private record Entry<T>(T value, Version version) {}

    private final String collectionName;
    private final Map<String, Entry<T>> entries = new LinkedHashMap<>();
    private final AtomicLong versionSequence = new AtomicLong();
    private final AtomicLong writeAttempts = new AtomicLong();
    private final AtomicLong writeCount = new AtomicLong();

    private long failingWrite = -1;

    protected InMemoryCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    protected synchronized void put(String id, T value, Version expected) {
        Objects.requireNonNull(expected, "Expected version cannot be null, use Version.ABSENT to create only");
        long attempt = writeAttempts.incrementAndGet();
        if (attempt == failingWrite) {
            log.debug("Injected failure on write #{} to {} ({})", attempt, collectionName, id);
            throw new StoreUnavailableException(
                "Injected failure writing " + id + " to " + collectionName);
        }

        Entry<T> current = entries.get(id);
        if (!expected.accepts(current == null ? null : current.version())) {
            throw new VersionConflictException(collectionName, id, expected);
        }

        Version version = Version.of(Long.toString(versionSequence.incrementAndGet()));
        entries.put(id, new Entry<>(value, version));
        writeCount.incrementAndGet();
        log.debug("Stored {} in {} at version {}", id, collectionName, version);
    }

    protected synchronized Optional<T> find(String id) {
        Entry<T> entry = entries.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    protected synchronized List<T> values() {
        List<T> result = new ArrayList<>(entries.size());
        entries.values().forEach(entry -> result.add(entry.value()));
        return result;
    }

    /**
     * Makes the n-th write attempt (1-based, counted from creation) fail with
     * {@link StoreUnavailableException}.
     */
    public synchronized void failOnWrite(long attempt) {
        log.info("Write #{} to {} will fail", attempt, collectionName);
        this.failingWrite = attempt;
    }

    /**
     * Number of writes that were applied.
     */
    public long getWriteCount() {
        return writeCount.get();
    }

    /**
     * Number of writes that were attempted, including failed ones.
     */
    public long getWriteAttempts() {
        return writeAttempts.get();
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Clears all entries and any injected failure. Useful for testing.
     */
    public synchronized void clear() {
        log.info("Clearing all data in {}", collectionName);
        entries.clear();
        failingWrite = -1;
    }
}
