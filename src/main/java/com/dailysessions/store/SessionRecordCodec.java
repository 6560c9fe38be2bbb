package com.dailysessions.store;

import com.dailysessions.Event;
import com.dailysessions.SessionedEvent;
import com.dailysessions.SessionizationException;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.joda.time.Duration;
import org.joda.time.Instant;
import org.joda.time.LocalDate;

import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of a {@link SessionedEvent} in the cleaned layer. Field names are snake_case and
 * instants are ISO-8601 UTC, so a row's text depends only on its values.
 */
public final class SessionRecordCodec {

    private static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .create();

    private SessionRecordCodec() {
    }

    public static String encode(SessionedEvent row) {
        Event event = row.getEvent();
        SessionRecord record = new SessionRecord();
        record.userId = event.getUserId();
        record.eventId = event.getEventId();
        record.productCode = event.getProductCode();
        record.timestamp = event.getTimestamp().toString();
        record.payload = new TreeMap<>(event.getPayload());
        record.isUserAction = row.isUserAction();
        record.timeDiffMs = row.getTimeDiff() == null ? null : row.getTimeDiff().getMillis();
        record.isNewSession = row.isNewSession();
        record.sessionGroupSeq = row.getSessionGroupSeq();
        record.sessionStartTime = row.getSessionStartTime().toString();
        record.sessionId = row.getSessionId();
        record.pdate = row.getPdate().toString();
        return GSON.toJson(record);
    }

    public static SessionedEvent decode(String line) {
        SessionRecord record;
        try {
            record = GSON.fromJson(line, SessionRecord.class);
        } catch (JsonParseException e) {
            throw new SessionizationException("unreadable session row: " + line, e);
        }
        if (record == null || record.userId == null || record.eventId == null || record.productCode == null
                || record.timestamp == null || record.sessionStartTime == null || record.sessionId == null
                || record.pdate == null) {
            throw new SessionizationException("incomplete session row: " + line);
        }
        try {
            Event event = new Event(record.userId, record.eventId, record.productCode,
                    Instant.parse(record.timestamp),
                    record.payload == null ? new TreeMap<>() : record.payload);
            return new SessionedEvent(
                    event,
                    record.isUserAction,
                    record.timeDiffMs == null ? null : Duration.millis(record.timeDiffMs),
                    record.isNewSession,
                    record.sessionGroupSeq,
                    Instant.parse(record.sessionStartTime),
                    record.sessionId,
                    LocalDate.parse(record.pdate));
        } catch (IllegalArgumentException e) {
            throw new SessionizationException("malformed session row: " + line, e);
        }
    }

    private static final class SessionRecord {
        String userId;
        String eventId;
        String productCode;
        String timestamp;
        Map<String, String> payload;
        boolean isUserAction;
        Long timeDiffMs;
        boolean isNewSession;
        long sessionGroupSeq;
        String sessionStartTime;
        String sessionId;
        String pdate;
    }
}
