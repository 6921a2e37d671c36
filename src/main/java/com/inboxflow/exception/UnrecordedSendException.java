package com.inboxflow.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The provider accepted a message but its SENT state could not be written.
 * Retrying the job would deliver the message twice, so the job is parked with
 * the provider id for manual reconciliation.
 */
@Getter
public class UnrecordedSendException extends ProcessingException {

    private final UUID messageId;
    private final String externalMessageId;

    public UnrecordedSendException(UUID messageId, String externalMessageId, Throwable cause) {
        super("Message " + messageId + " was accepted by the provider as " + externalMessageId
                + " but could not be recorded: " + cause.getMessage(), cause);
        this.messageId = messageId;
        this.externalMessageId = externalMessageId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
