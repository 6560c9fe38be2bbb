package com.dailysessions;

import org.joda.time.Duration;

import java.io.Serializable;
import java.util.Objects;

/**
 * A classified event with the time elapsed since the preceding event of the same
 * (user, product) timeline. The gap is null when no predecessor is in scope.
 */
public final class TimedEvent implements Serializable {

    private final ClassifiedEvent classified;
    private final Duration timeDiff;

    public TimedEvent(ClassifiedEvent classified, Duration timeDiff) {
        this.classified = Objects.requireNonNull(classified, "classified");
        this.timeDiff = timeDiff;
    }

    public ClassifiedEvent getClassified() {
        return classified;
    }

    public Event getEvent() {
        return classified.getEvent();
    }

    public Duration getTimeDiff() {
        return timeDiff;
    }

    public boolean hasPredecessor() {
        return timeDiff != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimedEvent)) {
            return false;
        }
        TimedEvent other = (TimedEvent) o;
        return classified.equals(other.classified) && Objects.equals(timeDiff, other.timeDiff);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classified, timeDiff);
    }

    @Override
    public String toString() {
        return "TimedEvent{" + classified + ", timeDiff=" + timeDiff + '}';
    }
}
