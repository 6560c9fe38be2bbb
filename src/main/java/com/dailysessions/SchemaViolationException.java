package com.dailysessions;

public class SchemaViolationException extends SessionizationException {

    private final String reason;
    private final String record;

    public SchemaViolationException(String reason, String record) {
        super(reason + ": " + record);
        this.reason = reason;
        this.record = record;
    }

    public String getReason() {
        return reason;
    }

    public String getRecord() {
        return record;
    }
}
