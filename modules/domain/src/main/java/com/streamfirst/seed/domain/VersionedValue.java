package com.streamfirst.seed.domain;

import lombok.NonNull;

import java.time.Instant;

/**
 * A value held by a key/value store together with the version tag the store issued for it.
 *
 * @param collection the collection the key lives in (e.g., "solution-settings")
 * @param key the key within the collection
 * @param data the stored value
 * @param version the version tag to use for a subsequent conditional write
 * @param modifiedAt when the store last wrote this value
 */
public record VersionedValue(
    @NonNull String collection,
    @NonNull String key,
    @NonNull String data,
    @NonNull Version version,
    @NonNull Instant modifiedAt
) {
}
