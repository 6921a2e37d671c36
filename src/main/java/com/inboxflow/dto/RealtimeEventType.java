package com.inboxflow.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/** Event names understood by the inbox UI's socket layer. */
public enum RealtimeEventType {
    MESSAGE_NEW("message:new"),
    CONVERSATION_NEW("conversation:new"),
    CONVERSATION_UPDATED("conversation:updated"),
    NOTIFICATION_NEW("notification:new");

    private final String wireName;

    RealtimeEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
