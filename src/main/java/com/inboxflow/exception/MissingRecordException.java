package com.inboxflow.exception;

/** The row a job points at does not exist. Retrying cannot make it appear. */
public class MissingRecordException extends ProcessingException {

    public MissingRecordException(String kind, Object id) {
        super(kind + " not found: " + id);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
