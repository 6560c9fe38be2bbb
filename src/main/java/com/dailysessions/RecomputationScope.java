package com.dailysessions;

import org.joda.time.LocalDate;

import java.io.Serializable;
import java.util.Objects;

/**
 * Date bounds of one run. The keys in scope are the (user_id, product_code) pairs of the batch;
 * they are resolved inside the pipeline by joining the batch with the reloaded history.
 *
 * <pre>
 *   contextFrom        rewriteFrom                 processDate
 *   |-- context ------>|-- recomputed + rewritten ---|----->
 * </pre>
 */
public final class RecomputationScope implements Serializable {

    private final LocalDate processDate;
    private final boolean bootstrap;
    private final LocalDate rewriteFrom;
    private final LocalDate contextFrom;

    private RecomputationScope(LocalDate processDate, boolean bootstrap, LocalDate rewriteFrom, LocalDate contextFrom) {
        this.processDate = Objects.requireNonNull(processDate, "processDate");
        this.bootstrap = bootstrap;
        this.rewriteFrom = rewriteFrom;
        this.contextFrom = contextFrom;
    }

    public static RecomputationScope bootstrap(LocalDate processDate) {
        return new RecomputationScope(processDate, true, null, null);
    }

    public static RecomputationScope incremental(LocalDate processDate, int lookbackDays, int extendedLookbackDays) {
        return new RecomputationScope(processDate, false,
                processDate.minusDays(lookbackDays),
                processDate.minusDays(extendedLookbackDays));
    }

    public LocalDate getProcessDate() {
        return processDate;
    }

    public boolean isBootstrap() {
        return bootstrap;
    }

    /** First day whose rows are recomputed; null for bootstrap runs. */
    public LocalDate getRewriteFrom() {
        return rewriteFrom;
    }

    /** First day reloaded from history; null for bootstrap runs. */
    public LocalDate getContextFrom() {
        return contextFrom;
    }

    /** History rows on these days seed the fold but are never rewritten. */
    public boolean isContext(LocalDate pdate) {
        return !bootstrap && pdate.isBefore(rewriteFrom);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecomputationScope)) {
            return false;
        }
        RecomputationScope other = (RecomputationScope) o;
        return bootstrap == other.bootstrap
                && processDate.equals(other.processDate)
                && Objects.equals(rewriteFrom, other.rewriteFrom)
                && Objects.equals(contextFrom, other.contextFrom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processDate, bootstrap, rewriteFrom, contextFrom);
    }

    @Override
    public String toString() {
        return bootstrap
                ? "RecomputationScope{bootstrap, processDate=" + processDate + '}'
                : "RecomputationScope{processDate=" + processDate
                + ", contextFrom=" + contextFrom + ", rewriteFrom=" + rewriteFrom + '}';
    }
}
