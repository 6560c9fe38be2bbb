package com.dailysessions;

import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;

/** Beam counters reported by a run. */
public final class SessionMetrics {

    public static final String NAMESPACE = "sessionization";

    public static final String EVENTS_PARSED = "events.parsed";
    public static final String EVENTS_REJECTED = "events.rejected";
    public static final String EVENTS_DUPLICATE = "events.duplicate";
    public static final String HISTORY_RELOADED = "history.reloaded";
    public static final String SESSIONS_STARTED = "sessions.started";
    public static final String ROWS_INSERTED = "rows.inserted";
    public static final String ROWS_REPLACED = "rows.replaced";
    public static final String ROWS_UNCHANGED = "rows.unchanged";

    private SessionMetrics() {
    }

    public static Counter counter(String name) {
        return Metrics.counter(NAMESPACE, name);
    }
}
