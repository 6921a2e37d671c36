package com.inboxflow.model;

public enum FlowExecutionStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
