package com.inboxflow.model;

public enum MessageDirection {
    INBOUND,
    OUTBOUND
}
