package com.dailysessions;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.joda.time.DateTimeZone;
import org.joda.time.Instant;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.ISODateTimeFormat;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses one JSON line of the raw layer into an {@link Event}.
 *
 * <p>{@code user_id}, {@code event_id} and {@code product_code} must be non-empty strings.
 * {@code timestamp} may be an ISO-8601 string, a {@code yyyy-MM-dd HH:mm:ss} string read in the
 * configured zone, or epoch milliseconds. Every other field is payload. Nothing is coerced: a
 * row that does not fit is rejected.
 */
public class RawEventParser implements Serializable {

    static final String USER_ID = "user_id";
    static final String EVENT_ID = "event_id";
    static final String PRODUCT_CODE = "product_code";
    static final String TIMESTAMP = "timestamp";

    private final String timeZone;

    public RawEventParser(DateTimeZone timeZone) {
        this.timeZone = timeZone.getID();
    }

    public Event parse(String line) {
        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(line);
            if (!element.isJsonObject()) {
                throw new SchemaViolationException("row is not a JSON object", line);
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new SchemaViolationException("row is not valid JSON", line);
        }

        String userId = requiredString(json, USER_ID, line);
        String eventId = requiredString(json, EVENT_ID, line);
        String productCode = requiredString(json, PRODUCT_CODE, line);
        Instant timestamp = requiredTimestamp(json, line);

        Map<String, String> payload = new TreeMap<>();
        for (Map.Entry<String, JsonElement> field : json.entrySet()) {
            String name = field.getKey();
            if (USER_ID.equals(name) || EVENT_ID.equals(name) || PRODUCT_CODE.equals(name) || TIMESTAMP.equals(name)) {
                continue;
            }
            JsonElement value = field.getValue();
            if (value.isJsonNull()) {
                continue;
            }
            payload.put(name, value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()
                    ? value.getAsString()
                    : value.toString());
        }
        return new Event(userId, eventId, productCode, timestamp, payload);
    }

    private static String requiredString(JsonObject json, String field, String line) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull()) {
            throw new SchemaViolationException("missing " + field, line);
        }
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            throw new SchemaViolationException(field + " must be a string", line);
        }
        String text = value.getAsString();
        if (text.isEmpty()) {
            throw new SchemaViolationException(field + " must not be empty", line);
        }
        return text;
    }

    private Instant requiredTimestamp(JsonObject json, String line) {
        JsonElement value = json.get(TIMESTAMP);
        if (value == null || value.isJsonNull()) {
            throw new SchemaViolationException("missing " + TIMESTAMP, line);
        }
        if (!value.isJsonPrimitive()) {
            throw new SchemaViolationException(TIMESTAMP + " must be a string or a number", line);
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            try {
                return new Instant(primitive.getAsBigDecimal().longValueExact());
            } catch (ArithmeticException e) {
                throw new SchemaViolationException(TIMESTAMP + " must be whole epoch milliseconds", line);
            }
        }
        if (!primitive.isString()) {
            throw new SchemaViolationException(TIMESTAMP + " must be a string or a number", line);
        }
        String text = primitive.getAsString();
        try {
            return formatterFor(text).parseDateTime(text).toInstant();
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException("unparseable " + TIMESTAMP, line);
        }
    }

    private DateTimeFormatter formatterFor(String text) {
        DateTimeZone zone = DateTimeZone.forID(timeZone);
        if (text.indexOf('T') < 0) {
            return DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").withZone(zone);
        }
        // Offsets in the text win over the zone.
        return ISODateTimeFormat.dateTimeParser().withZone(zone);
    }
}
