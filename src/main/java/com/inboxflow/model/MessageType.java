package com.inboxflow.model;

/**
 * Content kind of a message.
 * INTERACTIVE → reply buttons / list sent by us, or a button_reply/list_reply received
 * BUTTON      → quick-reply button press on a template message
 */
public enum MessageType {
    TEXT,
    IMAGE,
    VIDEO,
    AUDIO,
    DOCUMENT,
    LOCATION,
    CONTACT,
    INTERACTIVE,
    BUTTON,
    TEMPLATE,
    UNKNOWN
}
