package com.dailysessions.store;

import org.joda.time.LocalDate;

import java.util.Objects;

/**
 * Store-wide metadata: a version bumped by every commit that changes data, and the first day
 * the retention process still guarantees to be complete.
 */
public final class StoreManifest {

    private final long version;
    private final LocalDate retainedSince;

    public StoreManifest(long version, LocalDate retainedSince) {
        this.version = version;
        this.retainedSince = retainedSince;
    }

    public static StoreManifest empty() {
        return new StoreManifest(0L, null);
    }

    public long getVersion() {
        return version;
    }

    /** Null when nothing has been expired yet. */
    public LocalDate getRetainedSince() {
        return retainedSince;
    }

    public StoreManifest nextVersion() {
        return new StoreManifest(version + 1, retainedSince);
    }

    public StoreManifest withRetainedSince(LocalDate date) {
        return new StoreManifest(version, date);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StoreManifest)) {
            return false;
        }
        StoreManifest other = (StoreManifest) o;
        return version == other.version && Objects.equals(retainedSince, other.retainedSince);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, retainedSince);
    }

    @Override
    public String toString() {
        return "StoreManifest{version=" + version + ", retainedSince=" + retainedSince + '}';
    }
}
