package com.dailysessions;

/**
 * Run-level failure. Any of these leaves the cleaned layer as it was before the run.
 */
public class SessionizationException extends RuntimeException {

    public SessionizationException(String message) {
        super(message);
    }

    public SessionizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
