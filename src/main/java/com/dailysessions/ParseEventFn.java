package com.dailysessions;

import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.values.TupleTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw JSON lines into events. Malformed lines go to {@link #REJECTED}, or fail the run
 * under {@link RejectPolicy#REJECT_BATCH}.
 */
public class ParseEventFn extends DoFn<String, Event> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseEventFn.class);

    public static final TupleTag<Event> EVENTS = new TupleTag<Event>() {};
    public static final TupleTag<RejectedRecord> REJECTED = new TupleTag<RejectedRecord>() {};

    private final RawEventParser parser;
    private final RejectPolicy rejectPolicy;

    private final Counter parsed = SessionMetrics.counter(SessionMetrics.EVENTS_PARSED);
    private final Counter rejected = SessionMetrics.counter(SessionMetrics.EVENTS_REJECTED);

    public ParseEventFn(SessionizationConfig config) {
        this.parser = new RawEventParser(config.getTimeZone());
        this.rejectPolicy = config.getRejectPolicy();
    }

    @ProcessElement
    public void processElement(@Element String line, MultiOutputReceiver out) {
        if (line.trim().isEmpty()) {
            return;
        }
        Event event;
        try {
            event = parser.parse(line);
        } catch (SchemaViolationException e) {
            if (rejectPolicy == RejectPolicy.REJECT_BATCH) {
                throw e;
            }
            LOG.warn("Rejected raw row: {}", e.getMessage());
            rejected.inc();
            out.get(REJECTED).output(new RejectedRecord(line, e.getReason()));
            return;
        }
        parsed.inc();
        out.get(EVENTS).output(event);
    }
}
