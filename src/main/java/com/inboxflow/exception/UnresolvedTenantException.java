package com.inboxflow.exception;

/** No tenant owns the routing key of a webhook change; there is no safe target to retry against. */
public class UnresolvedTenantException extends ProcessingException {

    public UnresolvedTenantException(String routingKey) {
        super("No tenant found for routing key: " + routingKey);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
