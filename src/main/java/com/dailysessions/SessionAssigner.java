package com.dailysessions;

import org.joda.time.Instant;
import org.joda.time.LocalDate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups one ordered timeline into sessions and derives their identifiers.
 *
 * <p>The group sequence is a running count of new-session flags carried through a fold over the
 * timeline, so every (user_id, product_code) pair is computed independently of every other.
 */
public class SessionAssigner implements Serializable {

    private final SessionBoundaryDetector detector;
    private final SessionizationConfig config;

    public SessionAssigner(SessionizationConfig config) {
        this.detector = config.boundaryDetector();
        this.config = config;
    }

    public List<SessionedEvent> assign(List<TimedEvent> timeline) {
        return assign(timeline, Collections.nCopies(timeline.size(), null), 0L);
    }

    /**
     * @param timeline events of one pair, ordered with {@link TimelineOrder}
     * @param anchors  same size as the timeline; a non-null entry is a persisted assignment that
     *                 is kept as-is and resumes the fold from its sequence and start time
     * @param seqBase  sequence value before the first row, so the first new session gets
     *                 {@code seqBase + 1}
     */
    public List<SessionedEvent> assign(List<TimedEvent> timeline, List<SessionedEvent> anchors, long seqBase) {
        if (anchors.size() != timeline.size()) {
            throw new IllegalArgumentException("anchors must line up with the timeline");
        }
        List<SessionedEvent> assigned = new ArrayList<>(timeline.size());
        long seq = seqBase;
        Instant sessionStart = null;
        for (int i = 0; i < timeline.size(); i++) {
            TimedEvent timed = timeline.get(i);
            SessionedEvent anchor = anchors.get(i);
            if (anchor != null) {
                seq = anchor.getSessionGroupSeq();
                sessionStart = anchor.getSessionStartTime();
                assigned.add(anchor);
                continue;
            }

            Event event = timed.getEvent();
            boolean newSession = detector.isNewSession(timed);
            if (newSession) {
                seq++;
                sessionStart = event.getTimestamp();
            }
            LocalDate pdate = config.pdateOf(event.getTimestamp());
            assigned.add(new SessionedEvent(
                    event,
                    timed.getClassified().isUserAction(),
                    timed.getTimeDiff(),
                    newSession,
                    seq,
                    sessionStart,
                    SessionIds.sessionId(event.getUserId(), event.getProductCode(), sessionStart),
                    pdate));
        }
        return assigned;
    }
}
