package com.inboxflow.model;

/**
 * Review state of a message template, as reported by the provider's
 * message_template_status_update webhook.
 */
public enum TemplateStatus {
    PENDING,
    APPROVED,
    REJECTED,
    PAUSED,
    DISABLED,
    FLAGGED,
    IN_APPEAL
}
