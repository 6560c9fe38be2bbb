package com.dailysessions;

import com.dailysessions.store.PartitionedSessionStore;
import com.dailysessions.store.SessionRecordCodec;
import com.dailysessions.store.StoreManifest;
import org.apache.beam.sdk.coders.StringUtf8Coder;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.io.fs.EmptyMatchTreatment;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;
import org.joda.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Works out how much history a run has to touch.
 *
 * <p>Sessions only depend on the preceding event of the same (user_id, product_code) pair, so
 * recomputing the batch's keys over the last {@code lookbackDays} days, with one more block of
 * days loaded as read-only context, reproduces the sessions a full recomputation would give
 * for those days. Keys that do not occur in the batch are never read back or rewritten.
 */
public class IncrementalScopeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(IncrementalScopeResolver.class);

    private final SessionizationConfig config;
    private final PartitionedSessionStore store;

    public IncrementalScopeResolver(SessionizationConfig config, PartitionedSessionStore store) {
        this.config = config;
        this.store = store;
    }

    /**
     * @throws ScopeResolutionException when the context days have already been expired
     */
    public RecomputationScope resolve(StoreManifest manifest) {
        if (config.isFirstRun()) {
            RecomputationScope scope = RecomputationScope.bootstrap(config.getProcessDate());
            LOG.info("Bootstrap run, no history reload: {}", scope);
            return scope;
        }

        RecomputationScope scope = RecomputationScope.incremental(
                config.getProcessDate(), config.getLookbackDays(), config.getExtendedLookbackDays());
        LocalDate retainedSince = manifest.getRetainedSince();
        if (retainedSince != null && scope.getContextFrom().isBefore(retainedSince)) {
            throw new ScopeResolutionException("history needed for the lookback has been expired",
                    Collections.emptyList(), scope.getContextFrom(), retainedSince.minusDays(1));
        }
        LOG.info("Resolved {}", scope);
        return scope;
    }

    /** Live partitions the run reloads; empty for bootstrap runs. */
    public List<String> historyFiles(RecomputationScope scope) throws IOException {
        if (scope.isBootstrap()) {
            return new ArrayList<>();
        }
        List<String> files = store.partitionFilesFrom(scope.getContextFrom());
        LOG.info("Reloading {} history partitions from {}", files.size(), scope.getContextFrom());
        return files;
    }

    /**
     * Fails the run for a batch event older than the rewrite window: the history it would need
     * is not part of the reload.
     */
    static void requireInWindow(RecomputationScope scope, String key, LocalDate pdate) {
        if (scope.isContext(pdate)) {
            throw new ScopeResolutionException("batch event predates the rewrite window starting "
                    + scope.getRewriteFrom(), Collections.singletonList(key), pdate, scope.getRewriteFrom().minusDays(1));
        }
    }

    /** Reads the given session partitions back into {@link SessionedEvent}s. */
    public static ReadHistory readHistory(List<String> files) {
        return new ReadHistory(files);
    }

    public static class ReadHistory extends PTransform<PBegin, PCollection<SessionedEvent>> {

        private final List<String> files;

        ReadHistory(List<String> files) {
            this.files = new ArrayList<>(files);
        }

        @Override
        public PCollection<SessionedEvent> expand(PBegin begin) {
            return begin
                    .apply("HistoryPartitions", Create.of(files).withCoder(StringUtf8Coder.of()))
                    .apply("MatchPartitions", FileIO.matchAll().withEmptyMatchTreatment(EmptyMatchTreatment.ALLOW))
                    .apply("OpenPartitions", FileIO.readMatches())
                    .apply("ReadRows", TextIO.readFiles())
                    .apply("DecodeRows", ParDo.of(new DecodeHistoryFn()));
        }
    }

    static class DecodeHistoryFn extends DoFn<String, SessionedEvent> {

        private final Counter reloaded = SessionMetrics.counter(SessionMetrics.HISTORY_RELOADED);

        @ProcessElement
        public void processElement(@Element String line, OutputReceiver<SessionedEvent> out) {
            if (line.isEmpty()) {
                return;
            }
            reloaded.inc();
            out.output(SessionRecordCodec.decode(line));
        }
    }
}
