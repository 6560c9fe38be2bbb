package com.dailysessions;

import org.joda.time.DateTimeZone;
import org.joda.time.Duration;
import org.joda.time.Instant;
import org.joda.time.LocalDate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable view of {@link SessionizationOptions} that can travel inside DoFns.
 */
public final class SessionizationConfig implements Serializable {

    private final LocalDate processDate;
    private final boolean firstRun;
    private final Duration sessionTimeout;
    private final List<String> actionCodes;
    private final int lookbackDays;
    private final int extendedLookbackDays;
    private final RejectPolicy rejectPolicy;
    private final String timeZone;
    private final int retentionDays;

    private SessionizationConfig(Builder builder) {
        this.processDate = builder.processDate;
        this.firstRun = builder.firstRun;
        this.sessionTimeout = builder.sessionTimeout;
        this.actionCodes = Collections.unmodifiableList(new ArrayList<>(builder.actionCodes));
        this.lookbackDays = builder.lookbackDays;
        this.extendedLookbackDays = builder.extendedLookbackDays;
        this.rejectPolicy = builder.rejectPolicy;
        this.timeZone = builder.timeZone;
        this.retentionDays = builder.retentionDays;
    }

    public static SessionizationConfig fromOptions(SessionizationOptions options) {
        Builder builder = builder(parseDate(options.getProcessDate()))
                .firstRun(options.isFirstRun())
                .actionCodes(options.getActionCodes())
                .lookbackDays(options.getLookbackDays())
                .extendedLookbackDays(options.getExtendedLookbackDays())
                .rejectPolicy(options.getRejectPolicy())
                .timeZone(options.getTimeZone())
                .retentionDays(options.getRetentionDays());
        try {
            builder.sessionTimeout(Duration.parse(options.getSessionTimeout()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sessionTimeout is not an ISO-8601 duration: "
                    + options.getSessionTimeout(), e);
        }
        return builder.build();
    }

    public static Builder builder(LocalDate processDate) {
        return new Builder(processDate);
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            throw new IllegalArgumentException("processDate is required");
        }
        try {
            return LocalDate.parse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("processDate must be yyyy-MM-dd: " + value, e);
        }
    }

    public LocalDate getProcessDate() {
        return processDate;
    }

    public boolean isFirstRun() {
        return firstRun;
    }

    public Duration getSessionTimeout() {
        return sessionTimeout;
    }

    public List<String> getActionCodes() {
        return actionCodes;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public int getExtendedLookbackDays() {
        return extendedLookbackDays;
    }

    public RejectPolicy getRejectPolicy() {
        return rejectPolicy;
    }

    public DateTimeZone getTimeZone() {
        return DateTimeZone.forID(timeZone);
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public LocalDate pdateOf(Instant timestamp) {
        return timestamp.toDateTime(getTimeZone()).toLocalDate();
    }

    public EventClassifier classifier() {
        return new EventClassifier(actionCodes);
    }

    public SessionBoundaryDetector boundaryDetector() {
        return new SessionBoundaryDetector(sessionTimeout);
    }

    @Override
    public String toString() {
        return "SessionizationConfig{" +
                "processDate=" + processDate +
                ", firstRun=" + firstRun +
                ", sessionTimeout=" + sessionTimeout +
                ", actionCodes=" + actionCodes +
                ", lookbackDays=" + lookbackDays +
                ", extendedLookbackDays=" + extendedLookbackDays +
                ", rejectPolicy=" + rejectPolicy +
                ", timeZone=" + timeZone +
                ", retentionDays=" + retentionDays +
                '}';
    }

    public static final class Builder {
        private final LocalDate processDate;
        private boolean firstRun;
        private Duration sessionTimeout = Duration.standardMinutes(30);
        private List<String> actionCodes = Arrays.asList("a", "b", "c");
        private int lookbackDays = 5;
        private int extendedLookbackDays = 6;
        private RejectPolicy rejectPolicy = RejectPolicy.REJECT_ROWS;
        private String timeZone = "UTC";
        private int retentionDays = 14;

        private Builder(LocalDate processDate) {
            this.processDate = Objects.requireNonNull(processDate, "processDate");
        }

        public Builder firstRun(boolean value) {
            this.firstRun = value;
            return this;
        }

        public Builder sessionTimeout(Duration value) {
            this.sessionTimeout = value;
            return this;
        }

        public Builder actionCodes(List<String> value) {
            this.actionCodes = value;
            return this;
        }

        public Builder lookbackDays(int value) {
            this.lookbackDays = value;
            return this;
        }

        public Builder extendedLookbackDays(int value) {
            this.extendedLookbackDays = value;
            return this;
        }

        public Builder rejectPolicy(RejectPolicy value) {
            this.rejectPolicy = value;
            return this;
        }

        public Builder timeZone(String value) {
            this.timeZone = value;
            return this;
        }

        public Builder retentionDays(int value) {
            this.retentionDays = value;
            return this;
        }

        public SessionizationConfig build() {
            if (sessionTimeout == null || sessionTimeout.getMillis() <= 0) {
                throw new IllegalArgumentException("sessionTimeout must be positive: " + sessionTimeout);
            }
            if (actionCodes == null || actionCodes.isEmpty()) {
                throw new IllegalArgumentException("actionCodes must not be empty");
            }
            if (lookbackDays < 0) {
                throw new IllegalArgumentException("lookbackDays must not be negative: " + lookbackDays);
            }
            if (extendedLookbackDays <= lookbackDays) {
                throw new IllegalArgumentException("extendedLookbackDays (" + extendedLookbackDays
                        + ") must exceed lookbackDays (" + lookbackDays + ")");
            }
            // A session open on the first rewritten day must have started inside the context days.
            Duration contextSpan = Duration.standardDays(extendedLookbackDays - lookbackDays);
            if (sessionTimeout.isLongerThan(contextSpan)) {
                throw new IllegalArgumentException("sessionTimeout " + sessionTimeout
                        + " is longer than the context span of " + contextSpan);
            }
            if (extendedLookbackDays > retentionDays) {
                throw new IllegalArgumentException("extendedLookbackDays (" + extendedLookbackDays
                        + ") reaches past retention of " + retentionDays + " days");
            }
            if (rejectPolicy == null) {
                throw new IllegalArgumentException("rejectPolicy is required");
            }
            if (timeZone == null) {
                throw new IllegalArgumentException("timeZone is required");
            }
            try {
                DateTimeZone.forID(timeZone);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown timeZone: " + timeZone, e);
            }
            return new SessionizationConfig(this);
        }
    }
}
