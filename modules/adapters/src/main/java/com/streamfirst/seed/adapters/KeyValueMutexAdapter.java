package com.streamfirst.seed.adapters;

import com.streamfirst.seed.domain.StoreUnavailableException;
import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.domain.VersionConflictException;
import com.streamfirst.seed.domain.VersionedValue;
import com.streamfirst.seed.ports.KeyValuePort;
import com.streamfirst.seed.ports.MutexPort;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * MutexPort built on top of any KeyValuePort with conditional writes.
 *
 * <p>The mutex is a single record whose value is the acquisition time followed by the holder id.
 * A live record blocks other instances; a record older than the lease timeout is taken over with a
 * version-checked write, so when several instances reclaim the same stale lease only one wins.
 * The mutex is not re-entrant: a second {@code tryEnter} by the same holder fails while its own
 * lease is live.
 */
@Slf4j
public class KeyValueMutexAdapter implements MutexPort {

    private static final char SEPARATOR = ' ';

    private final KeyValuePort store;
    private final Clock clock;
    private final String holderId;

    public KeyValueMutexAdapter(KeyValuePort store) {
        this(store, Clock.systemUTC(), UUID.randomUUID().toString());
    }

    public KeyValueMutexAdapter(KeyValuePort store, Clock clock, String holderId) {
        this.store = store;
        this.clock = clock;
        this.holderId = holderId;
    }

    @Override
    public boolean tryEnter(String collection, String key, Duration timeout) {
        Instant now = clock.instant();
        try {
            Optional<VersionedValue> current = store.get(collection, key);
            Version expected = Version.ABSENT;

            if (current.isPresent()) {
                Lease lease = Lease.parse(current.get().data());
                if (lease != null && lease.acquiredAt().plus(timeout).isAfter(now)) {
                    log.debug("Mutex {}/{} is held by {} since {}",
                             collection, key, lease.holder(), lease.acquiredAt());
                    return false;
                }
                log.info("Reclaiming expired mutex {}/{} from {}",
                        collection, key, lease == null ? "unknown holder" : lease.holder());
                expected = current.get().version();
            }

            store.upsert(collection, key, new Lease(now, holderId).format(), expected);
            log.debug("Mutex {}/{} acquired by {}", collection, key, holderId);
            return true;
        } catch (VersionConflictException e) {
            log.debug("Lost the race for mutex {}/{}", collection, key);
            return false;
        } catch (StoreUnavailableException e) {
            log.warn("Could not reach lock store for mutex {}/{}: {}", collection, key, e.getMessage());
            return false;
        }
    }

    @Override
    public void leave(String collection, String key) {
        Optional<VersionedValue> current = store.get(collection, key);
        if (current.isEmpty()) {
            log.debug("Mutex {}/{} is not held", collection, key);
            return;
        }

        Lease lease = Lease.parse(current.get().data());
        if (lease != null && !holderId.equals(lease.holder())) {
            log.warn("Mutex {}/{} was taken over by {}, leaving it in place", collection, key, lease.holder());
            return;
        }

        try {
            store.delete(collection, key, current.get().version());
        } catch (VersionConflictException e) {
            log.warn("Mutex {}/{} was taken over while releasing it, leaving it in place", collection, key);
            return;
        }
        log.debug("Mutex {}/{} released by {}", collection, key, holderId);
    }

    public String getHolderId() {
        return holderId;
    }

    /**
     * Value of a mutex record.
     */
    record Lease(Instant acquiredAt, String holder) {

        String format() {
            return acquiredAt.toString() + SEPARATOR + holder;
        }

        /**
         * Parses a stored lease, or returns null if the record was not written by this adapter.
         */
        static Lease parse(String value) {
            int split = value.indexOf(SEPARATOR);
            String timestamp = split < 0 ? value : value.substring(0, split);
            String holder = split < 0 ? "" : value.substring(split + 1);
            try {
                return new Lease(Instant.parse(timestamp), holder);
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }
}
