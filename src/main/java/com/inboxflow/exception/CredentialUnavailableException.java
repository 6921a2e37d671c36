package com.inboxflow.exception;

/** The tenant has no valid provider credential. Sends fail fast until it is re-validated. */
public class CredentialUnavailableException extends ProcessingException {

    public CredentialUnavailableException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
