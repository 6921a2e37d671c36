package com.inboxflow.model.flow;

import java.util.Locale;
import java.util.Optional;

/**
 * The five node kinds a flow graph may contain. The stored "type" string is the
 * lower-case name ("start", "message", ...).
 */
public enum NodeType {
    START,
    MESSAGE,
    CONDITION,
    DELAY,
    ACTION;

    public static Optional<NodeType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
