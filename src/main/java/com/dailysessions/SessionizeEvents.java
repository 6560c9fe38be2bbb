package com.dailysessions;

import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.join.CoGbkResult;
import org.apache.beam.sdk.transforms.join.CoGroupByKey;
import org.apache.beam.sdk.transforms.join.KeyedPCollectionTuple;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.TupleTag;
import org.apache.beam.sdk.values.TypeDescriptor;
import org.apache.beam.sdk.values.TypeDescriptors;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the deduplicated batch, joins it with the reloaded history on
 * (user_id, product_code) and recomputes the sessions of every key present in the batch.
 */
public class SessionizeEvents extends PTransform<PCollection<Event>, PCollection<SessionedEvent>> {

    static final TupleTag<ScopedEvent> BATCH = new TupleTag<ScopedEvent>() {};
    static final TupleTag<ScopedEvent> HISTORY = new TupleTag<ScopedEvent>() {};

    private final SessionizationConfig config;
    private final RecomputationScope scope;
    private final PCollection<SessionedEvent> history;

    public SessionizeEvents(SessionizationConfig config, RecomputationScope scope, PCollection<SessionedEvent> history) {
        this.config = config;
        this.scope = scope;
        this.history = history;
    }

    @Override
    public PCollection<SessionedEvent> expand(PCollection<Event> batch) {
        EventClassifier classifier = config.classifier();

        PCollection<KV<KV<String, String>, ScopedEvent>> keyedBatch = batch
                .apply("ClassifyBatch", MapElements
                        .into(TypeDescriptors.kvs(
                                TypeDescriptors.kvs(TypeDescriptors.strings(), TypeDescriptors.strings()),
                                TypeDescriptor.of(ScopedEvent.class)))
                        .via((Event event) -> KV.of(PartitionKeys.of(event),
                                ScopedEvent.fromBatch(classifier.classify(event)))))
                .setCoder(PartitionKeys.keyedCoder(SerializableCoder.of(ScopedEvent.class)));

        PCollection<KV<KV<String, String>, ScopedEvent>> keyedHistory = history
                .apply("ClassifyHistory", MapElements
                        .into(TypeDescriptors.kvs(
                                TypeDescriptors.kvs(TypeDescriptors.strings(), TypeDescriptors.strings()),
                                TypeDescriptor.of(ScopedEvent.class)))
                        .via((SessionedEvent row) -> KV.of(PartitionKeys.of(row.getEvent()),
                                ScopedEvent.fromHistory(classifier.classify(row.getEvent()), row))))
                .setCoder(PartitionKeys.keyedCoder(SerializableCoder.of(ScopedEvent.class)));

        return KeyedPCollectionTuple.of(BATCH, keyedBatch)
                .and(HISTORY, keyedHistory)
                .apply("JoinBatchWithHistory", CoGroupByKey.create())
                .apply("SessionizePartitions", ParDo.of(new SessionizePartitionFn(config, scope)));
    }

    /**
     * Folds one (user_id, product_code) timeline. Keys with no batch rows are outside the
     * run's scope and produce nothing.
     */
    static class SessionizePartitionFn extends DoFn<KV<KV<String, String>, CoGbkResult>, SessionedEvent> {

        private final SessionizationConfig config;
        private final RecomputationScope scope;
        private final PartitionSessionizer sessionizer;

        private final Counter sessionsStarted = SessionMetrics.counter(SessionMetrics.SESSIONS_STARTED);

        SessionizePartitionFn(SessionizationConfig config, RecomputationScope scope) {
            this.config = config;
            this.scope = scope;
            this.sessionizer = new PartitionSessionizer(config, scope);
        }

        @ProcessElement
        public void processElement(@Element KV<KV<String, String>, CoGbkResult> element,
                                   OutputReceiver<SessionedEvent> out) {
            Iterable<ScopedEvent> batchRows = element.getValue().getAll(BATCH);
            if (!batchRows.iterator().hasNext()) {
                return;
            }

            String key = PartitionKeys.describe(element.getKey());
            List<ScopedEvent> rows = new ArrayList<>();
            for (ScopedEvent row : batchRows) {
                IncrementalScopeResolver.requireInWindow(scope, key, config.pdateOf(row.getEvent().getTimestamp()));
                rows.add(row);
            }
            element.getValue().getAll(HISTORY).forEach(rows::add);

            for (SessionedEvent sessioned : sessionizer.sessionize(rows)) {
                if (sessioned.isNewSession()) {
                    sessionsStarted.inc();
                }
                out.output(sessioned);
            }
        }
    }
}
