package com.dailysessions;

import com.dailysessions.store.CommitResult;
import com.dailysessions.store.PartitionedSessionStore;
import org.apache.beam.sdk.testing.PAssert;
import org.apache.beam.sdk.testing.TestPipeline;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.values.PCollection;
import org.joda.time.LocalDate;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.dailysessions.TestEvents.describe;
import static com.dailysessions.TestEvents.event;
import static com.dailysessions.TestEvents.persisted;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertEquals;

public class MergeSessionsTest {

    private static final LocalDate JAN_5 = LocalDate.parse("2024-01-05");
    private static final LocalDate JAN_6 = LocalDate.parse("2024-01-06");

    @Rule public final transient TestPipeline pipeline = TestPipeline.create();
    @Rule public final TemporaryFolder folder = new TemporaryFolder();

    private static List<String> describeAll(List<SessionedEvent> rows) {
        List<String> described = new ArrayList<>();
        rows.forEach(row -> described.add(describe(row)));
        return described;
    }

    @Test
    public void upsertReplacesByNaturalKeyAndKeepsUntouchedRows() {
        SessionedEvent kept = persisted(event("U2", "a", "P1", "2024-01-05T08:00:00Z"), true, 1L, "2024-01-05T08:00:00Z");
        SessionedEvent same = persisted(event("U1", "a", "P1", "2024-01-05T10:00:00Z"), true, 1L, "2024-01-05T10:00:00Z");
        SessionedEvent stale = persisted(event("U1", "a", "P1", "2024-01-05T11:05:00Z"), true, 2L, "2024-01-05T11:05:00Z");
        SessionedEvent fresh = persisted(event("U1", "a", "P1", "2024-01-05T11:05:00Z"), false, 1L, "2024-01-05T10:00:00Z");
        SessionedEvent added = persisted(event("U1", "c", "P1", "2024-01-05T10:45:00Z"), false, 1L, "2024-01-05T10:00:00Z");

        MergeSessions.Upsert upsert = MergeSessions.upsert(Arrays.asList(kept, same, stale), Arrays.asList(same, fresh, added));

        assertEquals(1, upsert.getInserted());
        assertEquals(1, upsert.getReplaced());
        assertEquals(1, upsert.getUnchanged());
        assertEquals(Arrays.asList(kept, same, fresh, added), upsert.getRows());
    }

    @Test
    public void stagedPdatesAreJoinedSortedAndDistinct() {
        assertEquals("2024-01-05,2024-01-06",
                MergeSessions.joinPdates(Arrays.asList("2024-01-06", "2024-01-05,2024-01-06", "")));
        assertEquals("", MergeSessions.joinPdates(Collections.emptyList()));
    }

    @Test
    public void stagesTouchedPartitionsOnly() throws Exception {
        PartitionedSessionStore store = new PartitionedSessionStore(folder.getRoot().getPath());
        SessionedEvent other = persisted(event("U2", "a", "P1", "2024-01-05T08:00:00Z"), true, 1L, "2024-01-05T08:00:00Z");
        SessionedEvent stale = persisted(event("U1", "a", "P1", "2024-01-05T11:05:00Z"), true, 2L, "2024-01-05T11:05:00Z");
        SessionedEvent untouched = persisted(event("U9", "a", "P9", "2024-01-04T08:00:00Z"), true, 1L, "2024-01-04T08:00:00Z");
        store.stagePartition("seed", JAN_5, Arrays.asList(other, stale));
        store.stagePartition("seed", LocalDate.parse("2024-01-04"), Collections.singletonList(untouched));
        store.markStaged("seed", Arrays.asList(JAN_5, LocalDate.parse("2024-01-04")));
        store.commit("seed", 0L, false);

        SessionedEvent fresh = persisted(event("U1", "a", "P1", "2024-01-05T11:05:00Z"), false, 1L, "2024-01-05T10:00:00Z");
        SessionedEvent next = persisted(event("U1", "a", "P1", "2024-01-06T08:00:00Z"), true, 2L, "2024-01-06T08:00:00Z");
        PCollection<String> staged = pipeline
                .apply(Create.of(fresh, next))
                .apply(new MergeSessions(store, "run-1", false));
        PAssert.that(staged).containsInAnyOrder("2024-01-05", "2024-01-06");
        pipeline.run().waitUntilFinish();

        CommitResult commit = store.commit("run-1", 1L, false);

        assertThat(commit.getRewritten(), contains(JAN_5, JAN_6));
        assertEquals(2L, commit.getVersion());
        assertThat(describeAll(store.readPartition(JAN_5)), contains(
                "U1|P1|2024-01-05T11:05:00.000Z|1|U1#P1#2024-01-05T10:00:00.000Z",
                "U2|P1|2024-01-05T08:00:00.000Z|1|U2#P1#2024-01-05T08:00:00.000Z"));
        assertEquals(Collections.singletonList(next), store.readPartition(JAN_6));
        assertEquals(Collections.singletonList(untouched), store.readPartition(LocalDate.parse("2024-01-04")));
    }
}
