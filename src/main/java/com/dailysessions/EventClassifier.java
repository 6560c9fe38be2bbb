package com.dailysessions;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/** Tags events whose event_id is one of the configured action codes as user actions. */
public class EventClassifier implements Serializable {

    private final TreeSet<String> actionCodes;

    public EventClassifier(Collection<String> actionCodes) {
        this.actionCodes = new TreeSet<>(actionCodes);
    }

    public ClassifiedEvent classify(Event event) {
        return new ClassifiedEvent(event, actionCodes.contains(event.getEventId()));
    }

    public Set<String> getActionCodes() {
        return Collections.unmodifiableSet(actionCodes);
    }
}
