package com.dailysessions;

import org.joda.time.Duration;

import java.io.Serializable;
import java.util.Objects;

/**
 * Decides whether an event opens a new session. A gap exactly equal to the timeout keeps the
 * event in the running session.
 */
public class SessionBoundaryDetector implements Serializable {

    private final Duration sessionTimeout;

    public SessionBoundaryDetector(Duration sessionTimeout) {
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");
    }

    public boolean isNewSession(TimedEvent event) {
        return !event.hasPredecessor() || event.getTimeDiff().isLongerThan(sessionTimeout);
    }

    public Duration getSessionTimeout() {
        return sessionTimeout;
    }
}
