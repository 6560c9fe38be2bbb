package com.dailysessions;

/** Another writer committed to, or is committing to, the same store. */
public class MergeConflictException extends SessionizationException {

    public MergeConflictException(String message) {
        super(message);
    }

    public MergeConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
