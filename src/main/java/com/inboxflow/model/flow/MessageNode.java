package com.inboxflow.model.flow;

import lombok.Getter;

import java.util.List;

/**
 * Sends a message to the contact. With buttons the node becomes a suspension
 * point: the path waits for the contact's reply, which resumes the flow here.
 */
@Getter
public class MessageNode extends FlowNode {

    /** Provider limit on reply buttons per interactive message. */
    public static final int MAX_BUTTONS = 3;

    private final String content;
    private final List<FlowButton> buttons;

    public MessageNode(String id, String content, List<FlowButton> buttons) {
        super(id, NodeType.MESSAGE);
        this.content = content;
        this.buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public boolean hasButtons() {
        return !buttons.isEmpty();
    }
}
