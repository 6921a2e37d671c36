package com.inboxflow.model.flow;

import lombok.Getter;

/**
 * Base of the typed flow node hierarchy. Each subclass carries exactly the fields
 * its kind needs; the interpreter switches on {@link #getType()}.
 */
@Getter
public abstract class FlowNode {

    private final String id;
    private final NodeType type;

    protected FlowNode(String id, NodeType type) {
        this.id = id;
        this.type = type;
    }
}
