package com.dailysessions;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.joda.time.Instant;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One raw occurrence as landed by the raw layer. The timestamp is assigned by the source,
 * not by arrival.
 */
@DefaultCoder(SerializableCoder.class)
public final class Event implements Serializable {

    private final String userId;
    private final String eventId;
    private final String productCode;
    private final Instant timestamp;
    private final TreeMap<String, String> payload;

    public Event(String userId, String eventId, String productCode, Instant timestamp) {
        this(userId, eventId, productCode, timestamp, Collections.emptyMap());
    }

    public Event(String userId, String eventId, String productCode, Instant timestamp, Map<String, String> payload) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.productCode = Objects.requireNonNull(productCode, "productCode");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.payload = new TreeMap<>(payload);
    }

    public String getUserId() {
        return userId;
    }

    public String getEventId() {
        return eventId;
    }

    public String getProductCode() {
        return productCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public SortedMap<String, String> getPayload() {
        return Collections.unmodifiableSortedMap(payload);
    }

    /**
     * Natural key of the event: (user_id, event_id, product_code, timestamp). Components are
     * length-prefixed so that no two distinct tuples share an encoding.
     */
    public String identityKey() {
        return userId.length() + ":" + userId
                + eventId.length() + ":" + eventId
                + productCode.length() + ":" + productCode
                + timestamp.getMillis();
    }

    public boolean sameIdentity(Event other) {
        return userId.equals(other.userId)
                && eventId.equals(other.eventId)
                && productCode.equals(other.productCode)
                && timestamp.equals(other.timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event other = (Event) o;
        return sameIdentity(other) && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, eventId, productCode, timestamp, payload);
    }

    @Override
    public String toString() {
        return "Event{" +
                "userId='" + userId + '\'' +
                ", eventId='" + eventId + '\'' +
                ", productCode='" + productCode + '\'' +
                ", timestamp=" + timestamp +
                ", payload=" + payload +
                '}';
    }
}
