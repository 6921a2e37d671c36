package com.inboxflow.model;

/**
 * What starts a flow.
 * KEYWORD             → inbound text contains one of the flow's comma-separated keywords
 * NEW_MESSAGE         → any inbound message
 * CONVERSATION_OPENED → first inbound message from a contact
 * BUTTON_CLICK        → reply to a button sent by a flow message node (resumes mid-flow)
 */
public enum FlowTriggerType {
    KEYWORD,
    NEW_MESSAGE,
    CONVERSATION_OPENED,
    BUTTON_CLICK
}
