package com.dailysessions.store;

import org.joda.time.LocalDate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CommitResult {

    private final long version;
    private final List<LocalDate> rewritten;
    private final List<LocalDate> unchanged;
    private final List<LocalDate> removed;

    public CommitResult(long version, List<LocalDate> rewritten, List<LocalDate> unchanged, List<LocalDate> removed) {
        this.version = version;
        this.rewritten = Collections.unmodifiableList(new ArrayList<>(rewritten));
        this.unchanged = Collections.unmodifiableList(new ArrayList<>(unchanged));
        this.removed = Collections.unmodifiableList(new ArrayList<>(removed));
    }

    /** Store version after the commit. */
    public long getVersion() {
        return version;
    }

    public List<LocalDate> getRewritten() {
        return rewritten;
    }

    public List<LocalDate> getUnchanged() {
        return unchanged;
    }

    public List<LocalDate> getRemoved() {
        return removed;
    }

    public boolean isNoop() {
        return rewritten.isEmpty() && removed.isEmpty();
    }

    @Override
    public String toString() {
        return "CommitResult{version=" + version
                + ", rewritten=" + rewritten
                + ", unchanged=" + unchanged
                + ", removed=" + removed + '}';
    }
}
