package com.dailysessions;

import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.joda.time.Instant;
import org.joda.time.LocalDate;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

/** Builders shared by the tests. */
public final class TestEvents {

    private static final EventClassifier ACTIONS = new EventClassifier(Arrays.asList("a", "b", "c"));

    private TestEvents() {
    }

    public static Instant at(String isoInstant) {
        return Instant.parse(isoInstant);
    }

    public static Event event(String userId, String eventId, String productCode, String isoInstant) {
        return new Event(userId, eventId, productCode, at(isoInstant));
    }

    public static Event event(String userId, String eventId, String productCode, String isoInstant,
                              Map<String, String> payload) {
        return new Event(userId, eventId, productCode, at(isoInstant), payload);
    }

    public static Map<String, String> payload(String key, String value) {
        return Collections.singletonMap(key, value);
    }

    /** A row as an earlier run would have persisted it. */
    public static SessionedEvent persisted(Event event, boolean newSession, long seq, String isoStart) {
        Instant start = at(isoStart);
        return new SessionedEvent(
                event,
                ACTIONS.classify(event).isUserAction(),
                newSession ? null : Duration.standardMinutes(1),
                newSession,
                seq,
                start,
                SessionIds.sessionId(event.getUserId(), event.getProductCode(), start),
                event.getTimestamp().toDateTime(DateTimeZone.UTC).toLocalDate());
    }

    public static SessionizationConfig config(String processDate) {
        return SessionizationConfig.builder(LocalDate.parse(processDate)).build();
    }

    /** First throwable of {@code type} in the cause chain of {@code thrown}, or null. */
    public static <T extends Throwable> T causeOf(Throwable thrown, Class<T> type) {
        for (Throwable cause = thrown; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return type.cast(cause);
            }
        }
        return null;
    }

    /** Compact rendering used to compare pipeline output. */
    public static String describe(SessionedEvent row) {
        Event event = row.getEvent();
        return event.getUserId() + "|" + event.getProductCode() + "|" + event.getTimestamp()
                + "|" + row.getSessionGroupSeq() + "|" + row.getSessionId();
    }
}
