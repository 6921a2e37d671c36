package com.inboxflow.model.flow;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FlowButton {
    private final String id;
    private final String label;
}
