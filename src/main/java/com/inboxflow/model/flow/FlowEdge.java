package com.inboxflow.model.flow;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FlowEdge {
    private final String id;
    private final String source;
    private final String target;
    // "true"/"false" on Condition branches, a button id on button-specific routes
    private final String sourceHandle;
}
