package com.inboxflow.model;

/**
 * Delivery state of a message. Receipts can arrive out of order, so the
 * progression only moves forward: PENDING → SENT → DELIVERED → READ.
 * FAILED can replace any state except READ.
 */
public enum MessageStatus {
    PENDING(0),
    SENT(1),
    DELIVERED(2),
    READ(3),
    FAILED(-1);

    private final int rank;

    MessageStatus(int rank) {
        this.rank = rank;
    }

    public boolean canTransitionTo(MessageStatus next) {
        if (next == this) {
            return false;
        }
        if (next == FAILED) {
            return this != READ;
        }
        if (this == FAILED) {
            return false;
        }
        return next.rank > this.rank;
    }
}
