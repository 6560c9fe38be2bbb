package com.dailysessions;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes the sessions of one (user_id, product_code) pair from the batch rows and the
 * history reloaded for it. Only rows inside the rewrite window are returned.
 */
public class PartitionSessionizer implements Serializable {

    private static final Comparator<ScopedEvent> ORDER =
            Comparator.comparing(ScopedEvent::getEvent, TimelineOrder.INSTANCE);

    private final SessionAssigner assigner;
    private final RecomputationScope scope;

    public PartitionSessionizer(SessionizationConfig config, RecomputationScope scope) {
        this.assigner = new SessionAssigner(config);
        this.scope = scope;
    }

    public List<SessionedEvent> sessionize(Iterable<ScopedEvent> rows) {
        Map<String, ScopedEvent> byIdentity = new HashMap<>();
        ScopedEvent earliestPersisted = null;
        for (ScopedEvent row : rows) {
            byIdentity.merge(row.getEvent().identityKey(), row, PartitionSessionizer::survivor);
            if (!row.isFromBatch() && (earliestPersisted == null || ORDER.compare(row, earliestPersisted) < 0)) {
                earliestPersisted = row;
            }
        }
        List<ScopedEvent> ordered = new ArrayList<>(byIdentity.values());
        ordered.sort(ORDER);
        if (ordered.isEmpty()) {
            return new ArrayList<>();
        }

        List<ClassifiedEvent> timeline = new ArrayList<>(ordered.size());
        List<SessionedEvent> anchors = new ArrayList<>(ordered.size());
        for (ScopedEvent row : ordered) {
            timeline.add(row.getClassified());
            anchors.add(isContext(row) ? row.getPersisted() : null);
        }

        long seqBase = earliestPersisted == null ? 0L : seqBefore(earliestPersisted.getPersisted());
        List<SessionedEvent> assigned = assigner.assign(GapCalculator.computeGaps(timeline), anchors, seqBase);

        List<SessionedEvent> recomputed = new ArrayList<>(assigned.size());
        for (int i = 0; i < assigned.size(); i++) {
            if (anchors.get(i) == null) {
                recomputed.add(assigned.get(i));
            }
        }
        return recomputed;
    }

    private boolean isContext(ScopedEvent row) {
        return !row.isFromBatch() && scope.isContext(row.getPersisted().getPdate());
    }

    /**
     * Sessions the persisted timeline had opened before {@code earliest}, the first persisted row
     * in scope. Everything older lies before the context days and is closed, so the fold carries
     * on from this count. Batch rows sorting before {@code earliest} open sessions on top of it
     * instead of restarting the numbering.
     */
    private static long seqBefore(SessionedEvent earliest) {
        long opened = earliest.getSessionGroupSeq() - (earliest.isNewSession() ? 1 : 0);
        return Math.max(0L, opened);
    }

    // Batch rows supersede persisted rows with the same natural key.
    private static ScopedEvent survivor(ScopedEvent left, ScopedEvent right) {
        if (left.isFromBatch()) {
            return left;
        }
        if (right.isFromBatch()) {
            return right;
        }
        return left.getPersisted().toString().compareTo(right.getPersisted().toString()) <= 0 ? left : right;
    }
}
