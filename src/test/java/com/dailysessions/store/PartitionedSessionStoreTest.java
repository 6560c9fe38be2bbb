package com.dailysessions.store;

import com.dailysessions.Event;
import com.dailysessions.MergeConflictException;
import com.dailysessions.SessionIds;
import com.dailysessions.SessionedEvent;
import com.dailysessions.SessionizationException;
import org.joda.time.Instant;
import org.joda.time.LocalDate;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class PartitionedSessionStoreTest {

    private static final LocalDate JAN_4 = LocalDate.parse("2024-01-04");
    private static final LocalDate JAN_5 = LocalDate.parse("2024-01-05");
    private static final LocalDate JAN_6 = LocalDate.parse("2024-01-06");

    @Rule public final TemporaryFolder folder = new TemporaryFolder();

    private Path root;
    private PartitionedSessionStore store;

    @Before
    public void setUp() {
        root = folder.getRoot().toPath().resolve("sessions");
        store = new PartitionedSessionStore(root.toString());
    }

    private static SessionedEvent row(String userId, String isoTimestamp) {
        Instant timestamp = Instant.parse(isoTimestamp);
        return new SessionedEvent(new Event(userId, "a", "P1", timestamp), true, null, true, 1L, timestamp,
                SessionIds.sessionId(userId, "P1", timestamp), LocalDate.parse(isoTimestamp.substring(0, 10)));
    }

    private void seed(LocalDate pdate, SessionedEvent... rows) throws Exception {
        long version = store.readManifest().getVersion();
        store.stagePartition("seed", pdate, Arrays.asList(rows));
        store.markStaged("seed", Collections.singletonList(pdate));
        store.commit("seed", version, false);
    }

    private List<Path> filesUnder(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    @Test
    public void emptyStore() throws Exception {
        assertEquals(StoreManifest.empty(), store.readManifest());
        assertThat(store.listPartitions(), empty());
        assertThat(store.readPartition(JAN_5), empty());
    }

    @Test
    public void commitPublishesStagedPartitionsSorted() throws Exception {
        SessionedEvent late = row("U1", "2024-01-05T11:00:00Z");
        SessionedEvent early = row("U1", "2024-01-05T09:00:00Z");
        SessionedEvent otherUser = row("U0", "2024-01-05T12:00:00Z");
        store.stagePartition("run", JAN_5, Arrays.asList(late, early, otherUser));
        store.markStaged("run", Collections.singletonList(JAN_5));
        assertThat(store.listPartitions(), empty());

        CommitResult commit = store.commit("run", 0L, false);

        assertEquals(1L, commit.getVersion());
        assertThat(commit.getRewritten(), contains(JAN_5));
        assertEquals(Arrays.asList(otherUser, early, late), store.readPartition(JAN_5));
        assertEquals(1L, store.readManifest().getVersion());
        assertThat(filesUnder(root.resolve("_staging").resolve("run")), empty());
        assertFalse(Files.exists(root.resolve("_commit.lock")));
    }

    @Test
    public void identicalPartitionsAreNotRewritten() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        Path partition = root.resolve("pdate=2024-01-05").resolve("sessions.jsonl");
        byte[] before = Files.readAllBytes(partition);

        store.stagePartition("again", JAN_5, Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")));
        store.markStaged("again", Collections.singletonList(JAN_5));
        CommitResult commit = store.commit("again", 1L, false);

        assertTrue(commit.isNoop());
        assertThat(commit.getUnchanged(), contains(JAN_5));
        assertEquals(1L, commit.getVersion());
        assertEquals(1L, store.readManifest().getVersion());
        assertTrue(Arrays.equals(before, Files.readAllBytes(partition)));
    }

    @Test
    public void staleVersionIsAConflict() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        store.stagePartition("slow", JAN_5, Collections.singletonList(row("U2", "2024-01-05T09:00:00Z")));
        store.markStaged("slow", Collections.singletonList(JAN_5));

        assertThrows(MergeConflictException.class, () -> store.commit("slow", 0L, false));

        assertEquals(Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")), store.readPartition(JAN_5));
        assertThat(filesUnder(root.resolve("_staging").resolve("slow")), empty());
    }

    @Test
    public void heldLockIsAConflict() throws Exception {
        Files.createDirectories(root);
        Files.createFile(root.resolve("_commit.lock"));
        store.stagePartition("blocked", JAN_5, Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")));
        store.markStaged("blocked", Collections.singletonList(JAN_5));

        MergeConflictException conflict =
                assertThrows(MergeConflictException.class, () -> store.commit("blocked", 0L, false));

        assertThat(conflict.getMessage(), containsString("an unknown writer"));

        assertThat(store.listPartitions(), empty());
        assertTrue(Files.exists(root.resolve("_commit.lock")));
    }

    @Test
    public void lockNamesTheRunHoldingIt() throws Exception {
        Files.createDirectories(root);
        Files.write(root.resolve("_commit.lock"),
                "{\"run_id\":\"crashed-run\",\"acquired_at\":\"2024-01-05T10:00:00.000Z\"}"
                        .getBytes(StandardCharsets.UTF_8));
        store.stagePartition("next", JAN_5, Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")));
        store.markStaged("next", Collections.singletonList(JAN_5));

        MergeConflictException conflict =
                assertThrows(MergeConflictException.class, () -> store.commit("next", 0L, false));

        assertThat(conflict.getMessage(), containsString("run crashed-run since 2024-01-05T10:00:00.000Z"));
        assertThat(store.listPartitions(), empty());
    }

    @Test
    public void commitWithoutRecordedStagingFails() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        store.stagePartition("worker-local", JAN_5, Collections.singletonList(row("U2", "2024-01-05T09:00:00Z")));

        SessionizationException failure =
                assertThrows(SessionizationException.class, () -> store.commit("worker-local", 1L, false));

        assertThat(failure.getMessage(), containsString("no staged output of run worker-local"));
        assertEquals(Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")), store.readPartition(JAN_5));
        assertEquals(1L, store.readManifest().getVersion());
        assertFalse(Files.exists(root.resolve("_commit.lock")));
        assertThat(filesUnder(root.resolve("_staging").resolve("worker-local")), empty());
    }

    @Test
    public void commitFailsWhenARecordedPartitionIsMissing() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        store.stagePartition("partial", JAN_5, Collections.singletonList(row("U2", "2024-01-05T09:00:00Z")));
        store.markStaged("partial", Arrays.asList(JAN_5, JAN_6));

        SessionizationException failure =
                assertThrows(SessionizationException.class, () -> store.commit("partial", 1L, false));

        assertThat(failure.getMessage(), containsString("pdate=2024-01-06"));
        assertThat(store.listPartitions(), contains(JAN_5));
        assertEquals(Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")), store.readPartition(JAN_5));
        assertEquals(1L, store.readManifest().getVersion());
    }

    @Test
    public void failedCommitPutsBackPublishedPartitions() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        Path partition = root.resolve("pdate=2024-01-05").resolve("sessions.jsonl");
        byte[] before = Files.readAllBytes(partition);
        // The manifest cannot be replaced while a directory sits where its temporary file goes.
        Files.createDirectories(root.resolve("_manifest.json.tmp"));

        store.stagePartition("broken", JAN_5, Collections.singletonList(row("U2", "2024-01-05T09:00:00Z")));
        store.stagePartition("broken", JAN_6, Collections.singletonList(row("U1", "2024-01-06T09:00:00Z")));
        store.markStaged("broken", Arrays.asList(JAN_5, JAN_6));

        assertThrows(IOException.class, () -> store.commit("broken", 1L, false));

        assertTrue(Arrays.equals(before, Files.readAllBytes(partition)));
        assertThat(store.listPartitions(), contains(JAN_5));
        assertEquals(1L, store.readManifest().getVersion());
        assertFalse(Files.exists(root.resolve("_commit.lock")));
        assertThat(filesUnder(root.resolve("_staging").resolve("broken")), empty());
    }

    @Test
    public void failedBootstrapPutsBackRemovedPartitions() throws Exception {
        seed(JAN_4, row("U1", "2024-01-04T09:00:00Z"));
        Files.createDirectories(root.resolve("_manifest.json.tmp"));

        store.stagePartition("bootstrap", JAN_6, Collections.singletonList(row("U1", "2024-01-06T09:00:00Z")));
        store.markStaged("bootstrap", Collections.singletonList(JAN_6));

        assertThrows(IOException.class, () -> store.commit("bootstrap", 1L, true));

        assertThat(store.listPartitions(), contains(JAN_4));
        assertEquals(Collections.singletonList(row("U1", "2024-01-04T09:00:00Z")), store.readPartition(JAN_4));
    }

    @Test
    public void replaceAllRemovesPartitionsThatWereNotStaged() throws Exception {
        seed(JAN_4, row("U1", "2024-01-04T09:00:00Z"));
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));

        store.stagePartition("bootstrap", JAN_6, Collections.singletonList(row("U1", "2024-01-06T09:00:00Z")));
        store.markStaged("bootstrap", Collections.singletonList(JAN_6));
        CommitResult commit = store.commit("bootstrap", 2L, true);

        assertThat(commit.getRewritten(), contains(JAN_6));
        assertThat(commit.getRemoved(), contains(JAN_4, JAN_5));
        assertThat(store.listPartitions(), contains(JAN_6));
        assertEquals(3L, store.readManifest().getVersion());
    }

    @Test
    public void abortDropsStagingOnly() throws Exception {
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        store.stagePartition("failed", JAN_5, Collections.singletonList(row("U2", "2024-01-05T09:00:00Z")));

        store.abort("failed");

        assertThat(filesUnder(root.resolve("_staging").resolve("failed")), empty());
        assertEquals(Collections.singletonList(row("U1", "2024-01-05T09:00:00Z")), store.readPartition(JAN_5));
    }

    @Test
    public void expireBeforeDropsOldPartitionsAndRecordsRetention() throws Exception {
        seed(JAN_4, row("U1", "2024-01-04T09:00:00Z"));
        seed(JAN_5, row("U1", "2024-01-05T09:00:00Z"));
        assertNull(store.readManifest().getRetainedSince());

        store.expireBefore(JAN_5);

        assertThat(store.listPartitions(), contains(JAN_5));
        assertEquals(new StoreManifest(2L, JAN_5), store.readManifest());
        List<String> files = store.partitionFilesFrom(JAN_4);
        assertEquals(1, files.size());
        assertTrue(files.get(0).endsWith("sessions.jsonl"));
        String manifest = new String(Files.readAllBytes(root.resolve("_manifest.json")), StandardCharsets.UTF_8);
        assertTrue(manifest.contains("\"retained_since\":\"2024-01-05\""));
    }
}
