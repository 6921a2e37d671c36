package com.inboxflow.exception;

/**
 * A flow graph is malformed: no start node, an edge to a missing node, an invalid
 * condition, too many buttons. Such a flow must not run, so this is never retried.
 */
public class FlowDefinitionException extends ProcessingException {

    public FlowDefinitionException(String message) {
        super(message);
    }

    public FlowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
