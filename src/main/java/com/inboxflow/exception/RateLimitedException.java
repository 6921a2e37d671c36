package com.inboxflow.exception;

import lombok.Getter;

/** The tenant's send bucket is empty. Retry no sooner than retryAfterSeconds. */
@Getter
public class RateLimitedException extends ProcessingException {

    private final long retryAfterSeconds;

    public RateLimitedException(String tenantId, long retryAfterSeconds) {
        super("Rate limit exceeded for tenant " + tenantId + ". Retry after " + retryAfterSeconds + "s");
        this.retryAfterSeconds = retryAfterSeconds;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    @Override
    public long getRetryAfterMillis() {
        return retryAfterSeconds * 1000;
    }
}
