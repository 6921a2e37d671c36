package com.inboxflow.dto;

/** Kind of work a queue envelope refers to; decides which topic a retry goes back to. */
public enum JobType {
    WEBHOOK_EVENT,
    MESSAGE_SEND
}
