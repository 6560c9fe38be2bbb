package com.dailysessions;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Order of events inside one (user_id, product_code) timeline: timestamp, then event_id.
 *
 * <p>Two events of the same timeline with equal timestamp and event_id share their natural key
 * and are collapsed before ordering, so this order is total on everything that reaches the gap
 * calculation.
 */
public final class TimelineOrder implements Comparator<Event>, Serializable {

    public static final TimelineOrder INSTANCE = new TimelineOrder();

    private TimelineOrder() {
    }

    @Override
    public int compare(Event left, Event right) {
        int byTime = left.getTimestamp().compareTo(right.getTimestamp());
        if (byTime != 0) {
            return byTime;
        }
        return left.getEventId().compareTo(right.getEventId());
    }

    /** Order used for persisted partitions, which hold many timelines. */
    public static Comparator<Event> acrossTimelines() {
        return Comparator.comparing(Event::getUserId)
                .thenComparing(Event::getProductCode)
                .thenComparing(INSTANCE);
    }

    private Object readResolve() {
        return INSTANCE;
    }
}
