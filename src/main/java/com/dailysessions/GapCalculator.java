package com.dailysessions;

import org.joda.time.Duration;

import java.util.ArrayList;
import java.util.List;

/** Computes the time elapsed since the previous event of one ordered timeline. */
public final class GapCalculator {

    private GapCalculator() {
    }

    /**
     * @param timeline events of a single (user_id, product_code) pair, already sorted with
     *                 {@link TimelineOrder}
     */
    public static List<TimedEvent> computeGaps(List<ClassifiedEvent> timeline) {
        List<TimedEvent> timed = new ArrayList<>(timeline.size());
        ClassifiedEvent previous = null;
        for (ClassifiedEvent current : timeline) {
            Duration timeDiff = previous == null
                    ? null
                    : new Duration(previous.getEvent().getTimestamp(), current.getEvent().getTimestamp());
            timed.add(new TimedEvent(current, timeDiff));
            previous = current;
        }
        return timed;
    }
}
