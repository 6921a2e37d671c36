package com.inboxflow.service.inbound;

/** What an inbound message did to the store. A duplicate delivery is a normal outcome, not an error. */
public enum InboundResult {
    CREATED,
    DUPLICATE,
    IGNORED
}
