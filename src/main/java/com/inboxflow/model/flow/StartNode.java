package com.inboxflow.model.flow;

public class StartNode extends FlowNode {

    public StartNode(String id) {
        super(id, NodeType.START);
    }
}
