package com.inboxflow.model;

/**
 * Lifecycle of a persisted webhook change.
 * PENDING → PROCESSING → PROCESSED, or FAILED (re-claimable while retries remain).
 */
public enum RawEventStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
