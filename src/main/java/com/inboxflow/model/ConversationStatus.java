package com.inboxflow.model;

public enum ConversationStatus {
    OPEN,
    PENDING,
    CLOSED
}
