package com.dailysessions;

import org.apache.beam.sdk.coders.KvCoder;
import org.apache.beam.sdk.coders.SerializableCoder;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.GroupByKey;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.WithKeys;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.TupleTag;
import org.apache.beam.sdk.values.TupleTagList;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses events sharing (user_id, event_id, product_code, timestamp) to one survivor.
 *
 * <p>Copies that share the natural key but differ in payload are not duplicates. They are all
 * sent to {@link #CONFLICTS}, or fail the run under {@link RejectPolicy#REJECT_BATCH}.
 */
public class DeduplicateEvents extends PTransform<PCollection<Event>, PCollectionTuple> {

    public static final TupleTag<Event> UNIQUE = new TupleTag<Event>() {};
    public static final TupleTag<RejectedRecord> CONFLICTS = new TupleTag<RejectedRecord>() {};

    private final RejectPolicy rejectPolicy;

    public DeduplicateEvents(RejectPolicy rejectPolicy) {
        this.rejectPolicy = rejectPolicy;
    }

    @Override
    public PCollectionTuple expand(PCollection<Event> events) {
        return events
                .apply("KeyByIdentity", WithKeys.of((Event event) -> event.identityKey()).withKeyType(TypeDescriptors.strings()))
                .setCoder(KvCoder.of(StringUtf8Coder.of(), SerializableCoder.of(Event.class)))
                .apply("GroupByIdentity", GroupByKey.create())
                .apply("CollapseDuplicates", ParDo.of(new CollapseDuplicatesFn(rejectPolicy))
                        .withOutputTags(UNIQUE, TupleTagList.of(CONFLICTS)));
    }

    static class CollapseDuplicatesFn extends DoFn<KV<String, Iterable<Event>>, Event> {

        private static final Logger LOG = LoggerFactory.getLogger(CollapseDuplicatesFn.class);

        private final RejectPolicy rejectPolicy;

        private final Counter duplicates = SessionMetrics.counter(SessionMetrics.EVENTS_DUPLICATE);
        private final Counter rejected = SessionMetrics.counter(SessionMetrics.EVENTS_REJECTED);

        CollapseDuplicatesFn(RejectPolicy rejectPolicy) {
            this.rejectPolicy = rejectPolicy;
        }

        @ProcessElement
        public void processElement(@Element KV<String, Iterable<Event>> element, MultiOutputReceiver out) {
            List<Event> copies = new ArrayList<>();
            element.getValue().forEach(copies::add);

            Event survivor = copies.get(0);
            boolean conflicting = copies.stream().anyMatch(copy -> !copy.equals(survivor));
            if (!conflicting) {
                duplicates.inc(copies.size() - 1L);
                out.get(UNIQUE).output(survivor);
                return;
            }

            if (rejectPolicy == RejectPolicy.REJECT_BATCH) {
                throw new SchemaViolationException("same natural key with different payloads", copies.toString());
            }
            LOG.warn("Rejected {} rows sharing a natural key with different payloads: {}", copies.size(), copies);
            rejected.inc(copies.size());
            for (Event copy : copies) {
                out.get(CONFLICTS).output(new RejectedRecord(copy.toString(), "same natural key with different payloads"));
            }
        }
    }
}
