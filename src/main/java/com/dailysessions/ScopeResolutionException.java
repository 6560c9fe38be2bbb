package com.dailysessions;

import org.joda.time.LocalDate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The history needed to recompute some keys is unavailable, so their sessions cannot be
 * guaranteed correct. An empty key list means every key of the batch is affected.
 */
public class ScopeResolutionException extends SessionizationException {

    private final List<String> affectedKeys;
    private final LocalDate from;
    private final LocalDate to;

    public ScopeResolutionException(String message, List<String> affectedKeys, LocalDate from, LocalDate to) {
        super(message + " [keys=" + (affectedKeys.isEmpty() ? "<all batch keys>" : affectedKeys)
                + ", range=" + from + ".." + to + "]");
        this.affectedKeys = new ArrayList<>(affectedKeys);
        this.from = from;
        this.to = to;
    }

    public List<String> getAffectedKeys() {
        return Collections.unmodifiableList(affectedKeys);
    }

    public LocalDate getFrom() {
        return from;
    }

    public LocalDate getTo() {
        return to;
    }
}
