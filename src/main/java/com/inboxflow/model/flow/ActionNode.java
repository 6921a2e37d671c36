package com.inboxflow.model.flow;

import lombok.Getter;

/**
 * Extension point for side effects such as tagging a contact or assigning an agent.
 * Currently executed as a pass-through.
 */
@Getter
public class ActionNode extends FlowNode {

    private final String kind;

    public ActionNode(String id, String kind) {
        super(id, NodeType.ACTION);
        this.kind = kind;
    }
}
