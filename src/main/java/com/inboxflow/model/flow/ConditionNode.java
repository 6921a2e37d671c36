package com.inboxflow.model.flow;

import lombok.Getter;

/**
 * Branches on one predicate. Outgoing edges are labelled with sourceHandle
 * "true" or "false"; exactly one of them is followed.
 */
@Getter
public class ConditionNode extends FlowNode {

    public static final String TRUE_HANDLE = "true";
    public static final String FALSE_HANDLE = "false";

    private final String field;
    private final ConditionOperator operator;
    private final String value;

    public ConditionNode(String id, String field, ConditionOperator operator, String value) {
        super(id, NodeType.CONDITION);
        this.field = field;
        this.operator = operator;
        this.value = value;
    }
}
