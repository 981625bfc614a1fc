package com.fuzzy.reconciliation.similarity;

/**
 * Raised by a scorer when a compared field holds a value that cannot be scored.
 * Callers treat the affected pair as score 0; the records themselves stay active.
 */
public class MalformedRecordException extends RuntimeException {

    private final String field;

    public MalformedRecordException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
