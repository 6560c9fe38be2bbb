package com.dailysessions;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.joda.time.Duration;
import org.joda.time.Instant;
import org.joda.time.LocalDate;

import java.io.Serializable;
import java.util.Objects;

/**
 * The persisted unit of the cleaned layer. Every event gets one, including events that form
 * a single-event session on their own.
 */
@DefaultCoder(SerializableCoder.class)
public final class SessionedEvent implements Serializable {

    private final Event event;
    private final boolean userAction;
    private final Duration timeDiff;
    private final boolean newSession;
    private final long sessionGroupSeq;
    private final Instant sessionStartTime;
    private final String sessionId;
    private final LocalDate pdate;

    public SessionedEvent(Event event,
                          boolean userAction,
                          Duration timeDiff,
                          boolean newSession,
                          long sessionGroupSeq,
                          Instant sessionStartTime,
                          String sessionId,
                          LocalDate pdate) {
        this.event = Objects.requireNonNull(event, "event");
        this.userAction = userAction;
        this.timeDiff = timeDiff;
        this.newSession = newSession;
        this.sessionGroupSeq = sessionGroupSeq;
        this.sessionStartTime = Objects.requireNonNull(sessionStartTime, "sessionStartTime");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.pdate = Objects.requireNonNull(pdate, "pdate");
    }

    public Event getEvent() {
        return event;
    }

    public boolean isUserAction() {
        return userAction;
    }

    public Duration getTimeDiff() {
        return timeDiff;
    }

    public boolean isNewSession() {
        return newSession;
    }

    public long getSessionGroupSeq() {
        return sessionGroupSeq;
    }

    public Instant getSessionStartTime() {
        return sessionStartTime;
    }

    public String getSessionId() {
        return sessionId;
    }

    public LocalDate getPdate() {
        return pdate;
    }

    public String identityKey() {
        return event.identityKey();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SessionedEvent)) {
            return false;
        }
        SessionedEvent other = (SessionedEvent) o;
        return userAction == other.userAction
                && newSession == other.newSession
                && sessionGroupSeq == other.sessionGroupSeq
                && event.equals(other.event)
                && Objects.equals(timeDiff, other.timeDiff)
                && sessionStartTime.equals(other.sessionStartTime)
                && sessionId.equals(other.sessionId)
                && pdate.equals(other.pdate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, userAction, timeDiff, newSession, sessionGroupSeq, sessionStartTime, sessionId, pdate);
    }

    @Override
    public String toString() {
        return "SessionedEvent{" +
                "event=" + event +
                ", userAction=" + userAction +
                ", timeDiff=" + timeDiff +
                ", newSession=" + newSession +
                ", sessionGroupSeq=" + sessionGroupSeq +
                ", sessionStartTime=" + sessionStartTime +
                ", sessionId='" + sessionId + '\'' +
                ", pdate=" + pdate +
                '}';
    }
}
