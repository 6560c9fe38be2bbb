package com.dailysessions;

import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.testing.TestPipeline;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.junit.Rule;
import org.junit.Test;

import static com.dailysessions.TestEvents.causeOf;
import static com.dailysessions.TestEvents.event;
import static com.dailysessions.TestEvents.payload;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;

public class DeduplicateEventsTest {

    @Rule public final transient TestPipeline pipeline = TestPipeline.create();

    @Test
    public void exactCopiesCollapseToOne() {
        Event first = event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "home"));
        Event copy = event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "home"));
        Event sameTimeOtherEvent = event("U1", "b", "P1", "2024-01-05T10:00:00Z");
        Event otherProduct = event("U1", "a", "P2", "2024-01-05T10:00:00Z");

        PCollectionTuple result = pipeline
                .apply(Create.of(first, copy, sameTimeOtherEvent, otherProduct))
                .apply(new DeduplicateEvents(RejectPolicy.REJECT_ROWS));

        PAssert.that(result.get(DeduplicateEvents.UNIQUE)).containsInAnyOrder(first, sameTimeOtherEvent, otherProduct);
        PAssert.that(result.get(DeduplicateEvents.CONFLICTS)).empty();
        pipeline.run().waitUntilFinish();
    }

    @Test
    public void payloadConflictsAreRejectedTogether() {
        Event home = event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "home"));
        Event cart = event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "cart"));
        Event unrelated = event("U2", "a", "P1", "2024-01-05T10:00:00Z");

        PCollectionTuple result = pipeline
                .apply(Create.of(home, cart, unrelated))
                .apply(new DeduplicateEvents(RejectPolicy.REJECT_ROWS));

        PAssert.that(result.get(DeduplicateEvents.UNIQUE)).containsInAnyOrder(unrelated);
        PAssert.that(result.get(DeduplicateEvents.CONFLICTS)).containsInAnyOrder(
                new RejectedRecord(home.toString(), "same natural key with different payloads"),
                new RejectedRecord(cart.toString(), "same natural key with different payloads"));
        pipeline.run().waitUntilFinish();
    }

    @Test
    public void payloadConflictFailsTheBatchUnderRejectBatch() {
        pipeline
                .apply(Create.of(
                        event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "home")),
                        event("U1", "a", "P1", "2024-01-05T10:00:00Z", payload("page", "cart"))))
                .apply(new DeduplicateEvents(RejectPolicy.REJECT_BATCH));

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> pipeline.run().waitUntilFinish());

        SchemaViolationException violation = causeOf(thrown, SchemaViolationException.class);
        assertNotNull(violation);
        assertEquals("same natural key with different payloads", violation.getReason());
    }
}
