package com.streamfirst.seed.domain;

import java.util.Objects;

/**
 * Opaque version tag (ETag) of a stored record, also used as the expected version of a
 * conditional write.
 *
 * <p>Two reserved tags exist: {@link #ANY} ({@code "*"}) accepts whatever is currently stored,
 * including nothing, and {@link #ABSENT} accepts only a key that does not exist yet.
 *
 * @param tag the version tag as issued by the store
 */
public record Version(String tag) {

    public static final Version ANY = new Version("*");
    public static final Version ABSENT = new Version("");

    public Version {
        Objects.requireNonNull(tag, "Version tag cannot be null");
    }

    public static Version of(String tag) {
        return new Version(tag);
    }

    public boolean isAny() {
        return ANY.tag.equals(tag);
    }

    public boolean isAbsent() {
        return tag.isEmpty();
    }

    /**
     * Checks whether a write expecting this version may overwrite {@code current}.
     *
     * @param current the stored version, or {@code null} when the key does not exist
     * @return true if the write should be applied
     */
    public boolean accepts(Version current) {
        if (isAny()) {
            return true;
        }
        if (isAbsent()) {
            return current == null;
        }
        return current != null && tag.equals(current.tag);
    }

    @Override
    public String toString() {
        return isAbsent() ? "<absent>" : tag;
    }
}
