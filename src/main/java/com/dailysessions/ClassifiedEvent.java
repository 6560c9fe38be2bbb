package com.dailysessions;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.SerializableCoder;

import java.io.Serializable;
import java.util.Objects;

@DefaultCoder(SerializableCoder.class)
public final class ClassifiedEvent implements Serializable {

    private final Event event;
    private final boolean userAction;

    public ClassifiedEvent(Event event, boolean userAction) {
        this.event = Objects.requireNonNull(event, "event");
        this.userAction = userAction;
    }

    public Event getEvent() {
        return event;
    }

    public boolean isUserAction() {
        return userAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClassifiedEvent)) {
            return false;
        }
        ClassifiedEvent other = (ClassifiedEvent) o;
        return userAction == other.userAction && event.equals(other.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, userAction);
    }

    @Override
    public String toString() {
        return "ClassifiedEvent{" + event + ", userAction=" + userAction + '}';
    }
}
