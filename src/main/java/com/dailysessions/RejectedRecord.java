package com.dailysessions;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.coders.SerializableCoder;

import java.io.Serializable;
import java.util.Objects;

/** A raw row kept out of the run, with the reason. */
@DefaultCoder(SerializableCoder.class)
public final class RejectedRecord implements Serializable {

    private static final Gson GSON = new Gson();

    private final String record;
    private final String reason;

    public RejectedRecord(String record, String reason) {
        this.record = record;
        this.reason = reason;
    }

    public String getRecord() {
        return record;
    }

    public String getReason() {
        return reason;
    }

    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("reason", reason);
        json.addProperty("record", record);
        return GSON.toJson(json);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RejectedRecord)) {
            return false;
        }
        RejectedRecord other = (RejectedRecord) o;
        return Objects.equals(record, other.record) && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(record, reason);
    }

    @Override
    public String toString() {
        return "RejectedRecord{reason='" + reason + "', record=" + record + '}';
    }
}
