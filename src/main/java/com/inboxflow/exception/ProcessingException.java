package com.inboxflow.exception;

/**
 * Base of the worker-level error taxonomy. Job boundaries catch these and turn
 * them into a state transition; {@link #isRetryable()} decides whether the job
 * goes back through the retry topic or is parked for manual inspection.
 */
public abstract class ProcessingException extends RuntimeException {

    protected ProcessingException(String message) {
        super(message);
    }

    protected ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();

    /**
     * Minimum wait before the next attempt, in milliseconds. 0 = use the regular backoff.
     */
    public long getRetryAfterMillis() {
        return 0;
    }

    /** Classifies any throwable raised inside a job. Unknown runtime failures count as transient. */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof ProcessingException) {
            return ((ProcessingException) error).isRetryable();
        }
        return true;
    }
}
