package com.dailysessions;

import com.dailysessions.store.CommitResult;
import com.dailysessions.store.PartitionedSessionStore;
import com.dailysessions.store.StoreManifest;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.io.FileSystems;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.transforms.Flatten;
import org.apache.beam.sdk.transforms.MapElements;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.TupleTagList;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Daily sessionization run: raw batch, deduplication, classification, join with the reloaded
 * history, session recomputation, staged upsert, commit.
 *
 * <pre>
 *   --processDate=2024-01-05 [--firstRun] [--sessionTimeout=PT30M] [--actionCodes=a,b,c]
 *   [--lookbackDays=5] [--extendedLookbackDays=6] [--rawDir=raw] [--storeDir=ods/sessions]
 *   [--rejectPolicy=REJECT_ROWS] [--rejectedOutput=rejected/2024-01-05] [--runner=FlinkRunner]
 * </pre>
 *
 * Runs for the same store must not overlap; overlapping commits are detected and fail with
 * {@link MergeConflictException}.
 */
public final class SessionizationJob {

    private static final Logger LOG = LoggerFactory.getLogger(SessionizationJob.class);

    private SessionizationJob() {
    }

    public static void main(String[] args) {
        PipelineOptionsFactory.register(SessionizationOptions.class);
        SessionizationOptions options = PipelineOptionsFactory.fromArgs(args)
                .withValidation()
                .as(SessionizationOptions.class);
        try {
            RunSummary summary = run(options);
            LOG.info("Sessionization run for {} committed: {}", options.getProcessDate(), summary);
        } catch (SessionizationException | IllegalArgumentException e) {
            LOG.error("Sessionization run for {} failed", options.getProcessDate(), e);
            System.exit(1);
        }
    }

    /**
     * Runs the pipeline and commits its output.
     *
     * @throws SessionizationException when the run fails; the store is left as it was
     * @throws IllegalArgumentException when the options are invalid
     */
    public static RunSummary run(SessionizationOptions options) {
        SessionizationConfig config = SessionizationConfig.fromOptions(options);
        LOG.info("Starting sessionization with {}", config);
        FileSystems.setDefaultPipelineOptions(options);

        PartitionedSessionStore store = new PartitionedSessionStore(options.getStoreDir());
        String input = resolveInput(options, config);
        String runId = config.getProcessDate() + "-" + UUID.randomUUID();

        StoreManifest manifest;
        List<String> historyFiles;
        IncrementalScopeResolver resolver = new IncrementalScopeResolver(config, store);
        RecomputationScope scope;
        try {
            manifest = store.readManifest();
            scope = resolver.resolve(manifest);
            historyFiles = resolver.historyFiles(scope);
        } catch (IOException e) {
            throw new SessionizationException("cannot read session store at " + store.getRoot(), e);
        }

        Pipeline pipeline = Pipeline.create(options);
        buildPipeline(pipeline, config, scope, input, historyFiles, store, runId, options.getRejectedOutput());

        PipelineResult result;
        try {
            result = pipeline.run();
            PipelineResult.State state = result.waitUntilFinish();
            if (state != PipelineResult.State.DONE) {
                throw new SessionizationException("pipeline finished in state " + state);
            }
        } catch (RuntimeException e) {
            SessionizationException failure = unwrap(e);
            discardStaging(store, runId, failure);
            throw failure;
        }

        CommitResult commit;
        try {
            commit = store.commit(runId, manifest.getVersion(), scope.isBootstrap());
        } catch (IOException e) {
            throw new SessionizationException("commit of run " + runId + " failed", e);
        }
        return new RunSummary(scope, commit, counters(result));
    }

    static void buildPipeline(Pipeline pipeline,
                              SessionizationConfig config,
                              RecomputationScope scope,
                              String input,
                              List<String> historyFiles,
                              PartitionedSessionStore store,
                              String runId,
                              String rejectedOutput) {
        PCollectionTuple parsed = pipeline
                .apply("ReadRawBatch", TextIO.read().from(input))
                .apply("ParseEvents", ParDo.of(new ParseEventFn(config))
                        .withOutputTags(ParseEventFn.EVENTS, TupleTagList.of(ParseEventFn.REJECTED)));

        PCollectionTuple deduplicated = parsed.get(ParseEventFn.EVENTS)
                .apply("Deduplicate", new DeduplicateEvents(config.getRejectPolicy()));

        if (rejectedOutput != null) {
            PCollectionList.of(parsed.get(ParseEventFn.REJECTED))
                    .and(deduplicated.get(DeduplicateEvents.CONFLICTS))
                    .apply("CollectRejected", Flatten.pCollections())
                    .apply("RejectedToJson", MapElements.into(TypeDescriptors.strings()).via(RejectedRecord::toJson))
                    .apply("WriteRejected", TextIO.write().to(rejectedOutput).withSuffix(".jsonl").withoutSharding());
        }

        PCollection<SessionedEvent> history = pipeline.apply("ReadHistory",
                IncrementalScopeResolver.readHistory(historyFiles));

        deduplicated.get(DeduplicateEvents.UNIQUE)
                .apply("Sessionize", new SessionizeEvents(config, scope, history))
                .apply("MergeSessions", new MergeSessions(store, runId, scope.isBootstrap()));
    }

    static String resolveInput(SessionizationOptions options, SessionizationConfig config) {
        if (options.getInputFile() != null) {
            return options.getInputFile();
        }
        Path batch = Paths.get(options.getRawDir(), config.getProcessDate() + ".jsonl");
        if (!Files.exists(batch)) {
            throw new ScopeResolutionException("raw batch for " + config.getProcessDate() + " not found at " + batch,
                    Collections.emptyList(), config.getProcessDate(), config.getProcessDate());
        }
        return batch.toString();
    }

    private static SessionizationException unwrap(RuntimeException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SessionizationException) {
                return (SessionizationException) cause;
            }
        }
        return new SessionizationException("pipeline failed", e);
    }

    private static void discardStaging(PartitionedSessionStore store, String runId, SessionizationException failure) {
        try {
            store.abort(runId);
        } catch (IOException e) {
            LOG.warn("Could not remove staging of failed run {}", runId, e);
            failure.addSuppressed(e);
        }
    }

    private static Map<String, Long> counters(PipelineResult result) {
        MetricQueryResults metrics = result.metrics().queryMetrics(MetricsFilter.builder()
                .addNameFilter(MetricNameFilter.inNamespace(SessionMetrics.NAMESPACE))
                .build());
        Map<String, Long> counters = new TreeMap<>();
        for (MetricResult<Long> counter : metrics.getCounters()) {
            counters.merge(counter.getName().getName(), counter.getAttempted(), Long::sum);
        }
        return counters;
    }
}
