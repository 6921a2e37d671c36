package com.inboxflow.exception;

/** Storage, broker or network hiccup. Always worth another attempt. */
public class TransientInfraException extends ProcessingException {

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
