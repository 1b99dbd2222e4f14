package com.laborjustice.casechain.exception;

/**
 * Thrown when a batch cannot be reconciled at all, e.g. the record batch
 * itself is missing. Data-quality problems inside a batch never raise it.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
