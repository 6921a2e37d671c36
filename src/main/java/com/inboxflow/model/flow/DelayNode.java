package com.inboxflow.model.flow;

import lombok.Getter;

@Getter
public class DelayNode extends FlowNode {

    private final long delayMs;

    public DelayNode(String id, long delayMs) {
        super(id, NodeType.DELAY);
        this.delayMs = delayMs;
    }
}
