package com.dailysessions;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.SerializableCoder;

import java.io.Serializable;
import java.util.Objects;

/**
 * An event inside one run's recomputation scope, tagged with where it came from. History rows
 * keep their persisted assignment so that read-only context rows can seed the session fold.
 */
@DefaultCoder(SerializableCoder.class)
public final class ScopedEvent implements Serializable {

    public enum Origin {
        BATCH,
        HISTORY
    }

    private final ClassifiedEvent classified;
    private final Origin origin;
    private final SessionedEvent persisted;

    private ScopedEvent(ClassifiedEvent classified, Origin origin, SessionedEvent persisted) {
        this.classified = Objects.requireNonNull(classified, "classified");
        this.origin = origin;
        this.persisted = persisted;
    }

    public static ScopedEvent fromBatch(ClassifiedEvent classified) {
        return new ScopedEvent(classified, Origin.BATCH, null);
    }

    public static ScopedEvent fromHistory(ClassifiedEvent classified, SessionedEvent persisted) {
        return new ScopedEvent(classified, Origin.HISTORY, Objects.requireNonNull(persisted, "persisted"));
    }

    public ClassifiedEvent getClassified() {
        return classified;
    }

    public Event getEvent() {
        return classified.getEvent();
    }

    public Origin getOrigin() {
        return origin;
    }

    /** Null for batch rows. */
    public SessionedEvent getPersisted() {
        return persisted;
    }

    public boolean isFromBatch() {
        return origin == Origin.BATCH;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScopedEvent)) {
            return false;
        }
        ScopedEvent other = (ScopedEvent) o;
        return origin == other.origin
                && classified.equals(other.classified)
                && Objects.equals(persisted, other.persisted);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classified, origin, persisted);
    }

    @Override
    public String toString() {
        return "ScopedEvent{" + origin + ", " + classified + '}';
    }
}
