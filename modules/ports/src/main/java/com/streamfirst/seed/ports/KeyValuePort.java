package com.streamfirst.seed.ports;

import com.streamfirst.seed.domain.Version;
import com.streamfirst.seed.domain.VersionedValue;

import java.util.Optional;

/**
 * Port for a key/value store with optimistic, version-checked writes.
 * Holds small coordination records such as the seed completion flag and mutex leases.
 */
public interface KeyValuePort {

    /**
     * Reads a value.
     *
     * @param collection the collection id
     * @param key the key within the collection
     * @return the stored value, or empty if the key does not exist
     * @throws com.streamfirst.seed.domain.StoreUnavailableException if the store cannot be reached
     */
    Optional<VersionedValue> get(String collection, String key);

    /**
     * Creates or replaces a value if the stored version satisfies {@code expected}.
     *
     * @param collection the collection id
     * @param key the key within the collection
     * @param data the new value
     * @param expected {@link Version#ANY} to overwrite unconditionally, {@link Version#ABSENT}
     *        to create only, or the version previously read; never {@code null}
     * @return the stored value with its new version
     * @throws com.streamfirst.seed.domain.VersionConflictException if the stored version differs
     * @throws com.streamfirst.seed.domain.StoreUnavailableException if the store cannot be reached
     */
    VersionedValue upsert(String collection, String key, String data, Version expected);

    /**
     * Deletes a value if the stored version satisfies {@code expected}. Deleting a missing key is
     * a no-op.
     *
     * @param collection the collection id
     * @param key the key within the collection
     * @param expected {@link Version#ANY} to delete unconditionally, or the version previously read
     * @throws com.streamfirst.seed.domain.VersionConflictException if the stored version differs
     * @throws com.streamfirst.seed.domain.StoreUnavailableException if the store cannot be reached
     */
    void delete(String collection, String key, Version expected);

    /**
     * Deletes a value whatever its version. Deleting a missing key is a no-op.
     */
    default void delete(String collection, String key) {
        delete(collection, key, Version.ANY);
    }

    /**
     * Checks whether a key exists.
     */
    default boolean exists(String collection, String key) {
        return get(collection, key).isPresent();
    }
}
