package com.dailysessions.store;

import com.dailysessions.MergeConflictException;
import com.dailysessions.SessionedEvent;
import com.dailysessions.SessionizationException;
import com.dailysessions.TimelineOrder;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.io.fs.MatchResult;
import org.apache.beam.sdk.io.fs.MoveOptions.StandardMoveOptions;
import org.apache.beam.sdk.io.fs.ResolveOptions.StandardResolveOptions;
import org.apache.beam.sdk.io.fs.ResourceId;
import org.apache.beam.sdk.util.MimeTypes;
import org.joda.time.Instant;
import org.joda.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleaned layer kept as one JSON-lines file per pdate partition.
 *
 * <pre>
 * root/_manifest.json
 * root/pdate=2024-01-05/sessions.jsonl
 * root/_staging/&lt;runId&gt;/pdate=2024-01-05/sessions.jsonl
 * root/_staging/&lt;runId&gt;/_partitions.txt
 * root/_commit.lock
 * </pre>
 *
 * All access goes through Beam's {@link FileSystems}, so the root may be any file system the
 * pipeline can reach, and it must be one every worker and the driver see alike. Writers stage
 * whole partitions, record the staged pdates, and publish them with {@link #commit}. A commit
 * refuses to run when the store changed since the writer read the manifest, and puts back every
 * partition it already moved when it fails before the new manifest is written.
 */
public class PartitionedSessionStore implements Serializable {

    private static final Logger LOG = LoggerFactory.getLogger(PartitionedSessionStore.class);

    private static final String MANIFEST = "_manifest.json";
    private static final String STAGING = "_staging";
    private static final String REPLACED = "_replaced";
    private static final String STAGED_LIST = "_partitions.txt";
    private static final String LOCK = "_commit.lock";
    private static final String PARTITION_PREFIX = "pdate=";
    private static final String PARTITION_FILE = "sessions.jsonl";

    private static final Pattern PARTITION_PATH =
            Pattern.compile("pdate=(\\d{4}-\\d{2}-\\d{2})[/\\\\]" + Pattern.quote(PARTITION_FILE) + "$");

    private static final Gson GSON = new Gson();

    private final String root;

    public PartitionedSessionStore(String root) {
        this.root = root;
    }

    public String getRoot() {
        return root;
    }

    public StoreManifest readManifest() throws IOException {
        ResourceId manifest = file(rootDir(), MANIFEST);
        if (!exists(manifest)) {
            return StoreManifest.empty();
        }
        JsonObject json = JsonParser.parseString(readText(manifest)).getAsJsonObject();
        LocalDate retainedSince = json.has("retained_since") && !json.get("retained_since").isJsonNull()
                ? LocalDate.parse(json.get("retained_since").getAsString())
                : null;
        return new StoreManifest(json.get("version").getAsLong(), retainedSince);
    }

    public List<LocalDate> listPartitions() throws IOException {
        return partitionsUnder(rootDir());
    }

    /** Files of the live partitions dated on or after {@code from}, oldest first. */
    public List<String> partitionFilesFrom(LocalDate from) throws IOException {
        List<String> files = new ArrayList<>();
        for (LocalDate pdate : listPartitions()) {
            if (!pdate.isBefore(from)) {
                files.add(partitionFile(rootDir(), pdate).toString());
            }
        }
        return files;
    }

    public List<SessionedEvent> readPartition(LocalDate pdate) throws IOException {
        ResourceId file = partitionFile(rootDir(), pdate);
        List<SessionedEvent> rows = new ArrayList<>();
        if (!exists(file)) {
            return rows;
        }
        try (BufferedReader reader = new BufferedReader(
                Channels.newReader(FileSystems.open(file), StandardCharsets.UTF_8.name()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isEmpty()) {
                    rows.add(SessionRecordCodec.decode(line));
                }
            }
        }
        return rows;
    }

    /** Writes the full content of one partition into the run's staging area. */
    public void stagePartition(String runId, LocalDate pdate, List<SessionedEvent> rows) throws IOException {
        List<SessionedEvent> sorted = new ArrayList<>(rows);
        sorted.sort(Comparator.comparing(SessionedEvent::getEvent, TimelineOrder.acrossTimelines()));
        StringBuilder content = new StringBuilder();
        for (SessionedEvent row : sorted) {
            content.append(SessionRecordCodec.encode(row)).append('\n');
        }
        writeText(partitionFile(stagingDir(runId), pdate), content.toString());
    }

    /**
     * Records which partitions the run staged. {@link #commit} publishes exactly these and
     * fails when one of them cannot be found.
     */
    public void markStaged(String runId, Collection<LocalDate> pdates) throws IOException {
        StringBuilder content = new StringBuilder();
        for (LocalDate pdate : new TreeSet<>(pdates)) {
            content.append(pdate).append('\n');
        }
        writeText(file(stagingDir(runId), STAGED_LIST), content.toString());
    }

    /**
     * Publishes every partition staged by {@code runId}.
     *
     * @param expectedVersion manifest version the run started from
     * @param replaceAll      also remove live partitions the run did not stage
     * @throws MergeConflictException  when another commit is in progress or has happened since
     *                                 {@code expectedVersion}
     * @throws SessionizationException when the staged output of the run is not visible here
     */
    public CommitResult commit(String runId, long expectedVersion, boolean replaceAll) throws IOException {
        acquireLock(runId);
        try {
            StoreManifest manifest = readManifest();
            if (manifest.getVersion() != expectedVersion) {
                throw new MergeConflictException("store " + root + " moved from version " + expectedVersion
                        + " to " + manifest.getVersion() + " during the run");
            }
            return publish(runId, manifest, stagedPartitions(runId), replaceAll);
        } finally {
            try {
                abort(runId);
            } finally {
                releaseLock();
            }
        }
    }

    private CommitResult publish(String runId, StoreManifest manifest, List<LocalDate> staged, boolean replaceAll)
            throws IOException {
        ResourceId rootDir = rootDir();
        ResourceId staging = stagingDir(runId);
        ResourceId replaced = directory(staging, REPLACED);

        List<LocalDate> rewritten = new ArrayList<>();
        List<LocalDate> unchanged = new ArrayList<>();
        List<LocalDate> backedUp = new ArrayList<>();
        List<LocalDate> removed = new ArrayList<>();
        try {
            for (LocalDate pdate : staged) {
                ResourceId source = partitionFile(staging, pdate);
                ResourceId target = partitionFile(rootDir, pdate);
                boolean live = exists(target);
                if (live && Arrays.equals(readBytes(source), readBytes(target))) {
                    unchanged.add(pdate);
                    continue;
                }
                if (live) {
                    move(target, partitionFile(replaced, pdate));
                    backedUp.add(pdate);
                }
                move(source, target);
                rewritten.add(pdate);
            }

            if (replaceAll) {
                TreeSet<LocalDate> keep = new TreeSet<>(staged);
                for (LocalDate pdate : listPartitions()) {
                    if (!keep.contains(pdate)) {
                        move(partitionFile(rootDir, pdate), partitionFile(replaced, pdate));
                        removed.add(pdate);
                    }
                }
            }

            StoreManifest next = manifest;
            if (!rewritten.isEmpty() || !removed.isEmpty()) {
                next = manifest.nextVersion();
                writeManifest(next);
            }
            LOG.info("Committed run {} to {}: {} rewritten, {} unchanged, {} removed, version {}",
                    runId, root, rewritten.size(), unchanged.size(), removed.size(), next.getVersion());
            return new CommitResult(next.getVersion(), rewritten, unchanged, removed);
        } catch (IOException | RuntimeException e) {
            rollBack(runId, rewritten, backedUp, removed, e);
            throw e;
        }
    }

    // Restores the live partitions a failed commit already replaced or removed.
    private void rollBack(String runId, List<LocalDate> rewritten, List<LocalDate> backedUp, List<LocalDate> removed,
                          Exception failure) {
        ResourceId rootDir = rootDir();
        ResourceId replaced = directory(stagingDir(runId), REPLACED);
        List<LocalDate> restore = new ArrayList<>(removed);
        restore.addAll(backedUp);
        for (LocalDate pdate : rewritten) {
            if (!backedUp.contains(pdate)) {
                try {
                    delete(Collections.singletonList(partitionFile(rootDir, pdate)));
                } catch (IOException e) {
                    failure.addSuppressed(e);
                }
            }
        }
        for (LocalDate pdate : restore) {
            try {
                move(partitionFile(replaced, pdate), partitionFile(rootDir, pdate));
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        LOG.warn("Commit of run {} failed, restored {} partitions of {}", runId, restore.size(), root, failure);
    }

    private List<LocalDate> stagedPartitions(String runId) throws IOException {
        ResourceId staging = stagingDir(runId);
        ResourceId list = file(staging, STAGED_LIST);
        if (!exists(list)) {
            throw new SessionizationException("no staged output of run " + runId + " under " + root
                    + "; the store must be on a file system shared by the driver and all workers");
        }
        List<LocalDate> staged = new ArrayList<>();
        for (String line : readText(list).split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            LocalDate pdate = LocalDate.parse(line);
            if (!exists(partitionFile(staging, pdate))) {
                throw new SessionizationException("staged partition pdate=" + pdate + " of run " + runId
                        + " is missing under " + root);
            }
            staged.add(pdate);
        }
        return staged;
    }

    /** Drops everything a run staged. Live partitions are not touched. */
    public void abort(String runId) throws IOException {
        ResourceId staging = stagingDir(runId);
        List<ResourceId> files = new ArrayList<>();
        for (MatchResult.Metadata metadata : match(staging.toString() + "**")) {
            files.add(metadata.resourceId());
        }
        delete(files);
    }

    /**
     * Used by the retention process: removes partitions older than {@code date} and records that
     * history before it is no longer available.
     */
    public void expireBefore(LocalDate date) throws IOException {
        acquireLock("retention-" + date);
        try {
            List<ResourceId> expired = new ArrayList<>();
            for (LocalDate pdate : listPartitions()) {
                if (pdate.isBefore(date)) {
                    expired.add(partitionFile(rootDir(), pdate));
                }
            }
            delete(expired);
            writeManifest(readManifest().withRetainedSince(date));
        } finally {
            releaseLock();
        }
    }

    private void acquireLock(String owner) throws IOException {
        ResourceId lock = file(rootDir(), LOCK);
        if (exists(lock)) {
            throw new MergeConflictException("store " + root + " is locked by " + describeLock(lock));
        }
        JsonObject json = new JsonObject();
        json.addProperty("run_id", owner);
        json.addProperty("acquired_at", Instant.now().toString());
        writeText(lock, GSON.toJson(json));
        // Two writers may both have seen no lock; the last one to write it owns it.
        String holder = lockHolder(lock);
        if (!owner.equals(holder)) {
            throw new MergeConflictException("store " + root + " is locked by " + describeLock(lock));
        }
    }

    private void releaseLock() throws IOException {
        delete(Collections.singletonList(file(rootDir(), LOCK)));
    }

    private String lockHolder(ResourceId lock) throws IOException {
        JsonObject json = readLock(lock);
        return json == null || !json.has("run_id") ? null : json.get("run_id").getAsString();
    }

    private String describeLock(ResourceId lock) throws IOException {
        JsonObject json = readLock(lock);
        if (json == null || !json.has("run_id")) {
            return "an unknown writer (" + lock + ")";
        }
        String since = json.has("acquired_at") ? json.get("acquired_at").getAsString() : "an unknown time";
        return "run " + json.get("run_id").getAsString() + " since " + since + " (" + lock + ")";
    }

    private JsonObject readLock(ResourceId lock) throws IOException {
        String text = readText(lock);
        try {
            JsonElement json = JsonParser.parseString(text);
            return json.isJsonObject() ? json.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            LOG.warn("Unreadable lock file {}", lock, e);
            return null;
        }
    }

    private void writeManifest(StoreManifest manifest) throws IOException {
        JsonObject json = new JsonObject();
        json.addProperty("version", manifest.getVersion());
        if (manifest.getRetainedSince() != null) {
            json.addProperty("retained_since", manifest.getRetainedSince().toString());
        }
        ResourceId target = file(rootDir(), MANIFEST);
        ResourceId tmp = file(rootDir(), MANIFEST + ".tmp");
        writeText(tmp, GSON.toJson(json));
        move(tmp, target);
    }

    private static List<LocalDate> partitionsUnder(ResourceId dir) throws IOException {
        String pattern = directory(dir, PARTITION_PREFIX + "*").resolve(PARTITION_FILE, StandardResolveOptions.RESOLVE_FILE)
                .toString();
        TreeSet<LocalDate> partitions = new TreeSet<>();
        for (MatchResult.Metadata metadata : match(pattern)) {
            Matcher matcher = PARTITION_PATH.matcher(metadata.resourceId().toString());
            if (matcher.find()) {
                partitions.add(LocalDate.parse(matcher.group(1)));
            }
        }
        return new ArrayList<>(partitions);
    }

    private static ResourceId partitionFile(ResourceId base, LocalDate pdate) {
        return directory(base, PARTITION_PREFIX + pdate).resolve(PARTITION_FILE, StandardResolveOptions.RESOLVE_FILE);
    }

    private ResourceId stagingDir(String runId) {
        return directory(directory(rootDir(), STAGING), runId);
    }

    private ResourceId rootDir() {
        return FileSystems.matchNewResource(root, true);
    }

    private static ResourceId directory(ResourceId parent, String name) {
        return parent.resolve(name, StandardResolveOptions.RESOLVE_DIRECTORY);
    }

    private static ResourceId file(ResourceId parent, String name) {
        return parent.resolve(name, StandardResolveOptions.RESOLVE_FILE);
    }

    private static List<MatchResult.Metadata> match(String pattern) throws IOException {
        return FileSystems.match(pattern, EmptyMatchTreatment.ALLOW).metadata();
    }

    private static boolean exists(ResourceId file) throws IOException {
        return !match(file.toString()).isEmpty();
    }

    private static void move(ResourceId source, ResourceId target) throws IOException {
        FileSystems.rename(Collections.singletonList(source), Collections.singletonList(target));
    }

    private static void delete(List<ResourceId> files) throws IOException {
        if (!files.isEmpty()) {
            FileSystems.delete(files, StandardMoveOptions.IGNORE_MISSING_FILES);
        }
    }

    private static byte[] readBytes(ResourceId file) throws IOException {
        try (InputStream in = Channels.newInputStream(FileSystems.open(file))) {
            return in.readAllBytes();
        }
    }

    private static String readText(ResourceId file) throws IOException {
        return new String(readBytes(file), StandardCharsets.UTF_8);
    }

    private static void writeText(ResourceId file, String text) throws IOException {
        try (OutputStream out = Channels.newOutputStream(FileSystems.create(file, MimeTypes.TEXT))) {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        }
    }
}
