package com.dailysessions;

public enum RejectPolicy {
    /** Drop the offending rows to the rejected output and keep going. */
    REJECT_ROWS,
    /** Fail the whole run on the first offending row. */
    REJECT_BATCH
}
