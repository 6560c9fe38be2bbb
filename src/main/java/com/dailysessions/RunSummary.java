package com.dailysessions;

import com.dailysessions.store.CommitResult;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** Outcome of a committed run. */
public final class RunSummary {

    private final RecomputationScope scope;
    private final CommitResult commit;
    private final Map<String, Long> counters;

    public RunSummary(RecomputationScope scope, CommitResult commit, Map<String, Long> counters) {
        this.scope = scope;
        this.commit = commit;
        this.counters = Collections.unmodifiableMap(new TreeMap<>(counters));
    }

    public RecomputationScope getScope() {
        return scope;
    }

    public CommitResult getCommit() {
        return commit;
    }

    public Map<String, Long> getCounters() {
        return counters;
    }

    public long counter(String name) {
        return counters.getOrDefault(name, 0L);
    }

    @Override
    public String toString() {
        return "RunSummary{" + scope + ", " + commit + ", counters=" + counters + '}';
    }
}
