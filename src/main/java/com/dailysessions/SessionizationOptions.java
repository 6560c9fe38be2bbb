package com.dailysessions;

import org.apache.beam.sdk.options.Default;
import org.apache.beam.sdk.options.DefaultValueFactory;
import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.Validation;

import java.util.Arrays;
import java.util.List;

/**
 * Run parameters of one daily sessionization run.
 */
public interface SessionizationOptions extends PipelineOptions {

    @Description("Business date of the batch, yyyy-MM-dd")
    @Validation.Required
    String getProcessDate();

    void setProcessDate(String value);

    @Description("Bootstrap run: load the batch without history and overwrite the whole store")
    @Default.Boolean(false)
    boolean isFirstRun();

    void setFirstRun(boolean value);

    @Description("Inactivity gap that closes a session, ISO-8601 duration")
    @Default.String("PT30M")
    String getSessionTimeout();

    void setSessionTimeout(String value);

    @Description("event_id values that count as user actions")
    @Default.InstanceFactory(DefaultActionCodes.class)
    List<String> getActionCodes();

    void setActionCodes(List<String> value);

    @Description("Days before the process date whose sessions are recomputed and rewritten")
    @Default.Integer(5)
    int getLookbackDays();

    void setLookbackDays(int value);

    @Description("Days before the process date reloaded as read-only context")
    @Default.Integer(6)
    int getExtendedLookbackDays();

    void setExtendedLookbackDays(int value);

    @Description("Root of the raw layer; the batch is read from <rawDir>/<processDate>.jsonl")
    @Default.String("raw")
    String getRawDir();

    void setRawDir(String value);

    @Description("Explicit batch file or glob, overrides rawDir")
    String getInputFile();

    void setInputFile(String value);

    @Description("Root directory of the cleaned session store")
    @Default.String("ods/sessions")
    String getStoreDir();

    void setStoreDir(String value);

    @Description("What to do with malformed or conflicting rows")
    @Default.Enum("REJECT_ROWS")
    RejectPolicy getRejectPolicy();

    void setRejectPolicy(RejectPolicy value);

    @Description("File prefix for rejected rows; rejected rows are only logged when unset")
    String getRejectedOutput();

    void setRejectedOutput(String value);

    @Description("Time zone used to derive pdate and day boundaries")
    @Default.String("UTC")
    String getTimeZone();

    void setTimeZone(String value);

    @Description("Days of history the raw and cleaned layers retain")
    @Default.Integer(14)
    int getRetentionDays();

    void setRetentionDays(int value);

    class DefaultActionCodes implements DefaultValueFactory<List<String>> {
        @Override
        public List<String> create(PipelineOptions options) {
            return Arrays.asList("a", "b", "c");
        }
    }
}
