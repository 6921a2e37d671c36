package com.inboxflow.exception;

import lombok.Getter;

/**
 * The provider answered a send call with an error.
 *
 *   RATE_LIMITED  → provider throttling; back off and retry
 *   AUTH_INVALID  → token revoked or expired; the credential is invalidated
 *   BAD_PARAMETER → payload rejected; permanent
 *   UNDELIVERABLE → recipient cannot receive (blocked, not on the network); permanent
 *   UNKNOWN       → provider-side failure (5xx, unmapped codes); retried
 */
@Getter
public class ProviderRejectionException extends ProcessingException {

    public enum Kind {
        RATE_LIMITED,
        AUTH_INVALID,
        BAD_PARAMETER,
        UNDELIVERABLE,
        UNKNOWN
    }

    private final Kind kind;
    private final int httpStatus;
    private final Integer providerCode;

    public ProviderRejectionException(Kind kind, int httpStatus, Integer providerCode, String message) {
        super(message);
        this.kind = kind;
        this.httpStatus = httpStatus;
        this.providerCode = providerCode;
    }

    @Override
    public boolean isRetryable() {
        return kind == Kind.RATE_LIMITED || kind == Kind.UNKNOWN;
    }
}
