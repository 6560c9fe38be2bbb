package com.dailysessions;

import com.dailysessions.store.PartitionedSessionStore;
import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.transforms.Combine;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.WithKeys;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.joda.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Upserts recomputed rows into the pdate partitions they belong to, keyed by
 * (user_id, event_id, product_code, timestamp). Each touched partition is staged in full; the
 * driver publishes the staged partitions once the pipeline has succeeded. Partitions without
 * recomputed rows are not touched, and a persisted row only ever disappears by being replaced.
 *
 * <p>Emits the pdate of every staged partition. Once all partitions are staged their pdates are
 * recorded in the staging area, so the commit can tell a complete run from one whose output it
 * cannot see.
 */
public class MergeSessions extends PTransform<PCollection<SessionedEvent>, PCollection<String>> {

    private final PartitionedSessionStore store;
    private final String runId;
    private final boolean overwrite;

    /**
     * @param overwrite ignore persisted rows; used by bootstrap runs
     */
    public MergeSessions(PartitionedSessionStore store, String runId, boolean overwrite) {
        this.store = store;
        this.runId = runId;
        this.overwrite = overwrite;
    }

    @Override
    public PCollection<String> expand(PCollection<SessionedEvent> rows) {
        PCollection<String> staged = rows
                .apply("KeyByPdate", WithKeys.of((SessionedEvent row) -> row.getPdate().toString())
                        .withKeyType(TypeDescriptors.strings()))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), SerializableCoder.of(SessionedEvent.class)))
                .apply("GroupByPdate", GroupByKey.create())
                .apply("StagePartitions", ParDo.of(new StagePartitionFn(store, runId, overwrite)));

        staged
                .apply("CollectStaged", Combine.globally(MergeSessions::joinPdates))
                .apply("RecordStaged", ParDo.of(new RecordStagedFn(store, runId)));
        return staged;
    }

    // Comma-joined, sorted and distinct; partial results may be joined again.
    static String joinPdates(Iterable<String> parts) {
        TreeSet<String> pdates = new TreeSet<>();
        for (String part : parts) {
            for (String pdate : part.split(",")) {
                if (!pdate.isEmpty()) {
                    pdates.add(pdate);
                }
            }
        }
        return String.join(",", pdates);
    }

    /** Keyed upsert of {@code fresh} into {@code persisted}. */
    public static Upsert upsert(List<SessionedEvent> persisted, Iterable<SessionedEvent> fresh) {
        Map<String, SessionedEvent> byKey = new LinkedHashMap<>();
        for (SessionedEvent row : persisted) {
            byKey.put(row.identityKey(), row);
        }
        int inserted = 0;
        int replaced = 0;
        int unchanged = 0;
        for (SessionedEvent row : fresh) {
            SessionedEvent previous = byKey.put(row.identityKey(), row);
            if (previous == null) {
                inserted++;
            } else if (previous.equals(row)) {
                unchanged++;
            } else {
                replaced++;
            }
        }
        return new Upsert(new ArrayList<>(byKey.values()), inserted, replaced, unchanged);
    }

    public static final class Upsert {
        private final List<SessionedEvent> rows;
        private final int inserted;
        private final int replaced;
        private final int unchanged;

        Upsert(List<SessionedEvent> rows, int inserted, int replaced, int unchanged) {
            this.rows = rows;
            this.inserted = inserted;
            this.replaced = replaced;
            this.unchanged = unchanged;
        }

        public List<SessionedEvent> getRows() {
            return rows;
        }

        public int getInserted() {
            return inserted;
        }

        public int getReplaced() {
            return replaced;
        }

        public int getUnchanged() {
            return unchanged;
        }
    }

    static class RecordStagedFn extends DoFn<String, Void> {

        private static final Logger LOG = LoggerFactory.getLogger(RecordStagedFn.class);

        private final PartitionedSessionStore store;
        private final String runId;

        RecordStagedFn(PartitionedSessionStore store, String runId) {
            this.store = store;
            this.runId = runId;
        }

        @ProcessElement
        public void processElement(@Element String joined) throws IOException {
            List<LocalDate> pdates = new ArrayList<>();
            for (String pdate : joined.split(",")) {
                if (!pdate.isEmpty()) {
                    pdates.add(LocalDate.parse(pdate));
                }
            }
            store.markStaged(runId, pdates);
            LOG.info("Run {} staged {} partitions: {}", runId, pdates.size(), pdates);
        }
    }

    static class StagePartitionFn extends DoFn<KV<String, Iterable<SessionedEvent>>, String> {

        private static final Logger LOG = LoggerFactory.getLogger(StagePartitionFn.class);

        private final PartitionedSessionStore store;
        private final String runId;
        private final boolean overwrite;

        private final Counter inserted = SessionMetrics.counter(SessionMetrics.ROWS_INSERTED);
        private final Counter replaced = SessionMetrics.counter(SessionMetrics.ROWS_REPLACED);
        private final Counter unchanged = SessionMetrics.counter(SessionMetrics.ROWS_UNCHANGED);

        StagePartitionFn(PartitionedSessionStore store, String runId, boolean overwrite) {
            this.store = store;
            this.runId = runId;
            this.overwrite = overwrite;
        }

        @ProcessElement
        public void processElement(@Element KV<String, Iterable<SessionedEvent>> partition,
                                   OutputReceiver<String> out) throws IOException {
            LocalDate pdate = LocalDate.parse(partition.getKey());
            List<SessionedEvent> persisted = overwrite ? new ArrayList<>() : store.readPartition(pdate);
            Upsert upsert = upsert(persisted, partition.getValue());

            store.stagePartition(runId, pdate, upsert.getRows());
            inserted.inc(upsert.getInserted());
            replaced.inc(upsert.getReplaced());
            unchanged.inc(upsert.getUnchanged());
            LOG.info("Staged pdate={}: {} inserted, {} replaced, {} unchanged, {} rows total",
                    pdate, upsert.getInserted(), upsert.getReplaced(), upsert.getUnchanged(), upsert.getRows().size());
            out.output(partition.getKey());
        }
    }
}
