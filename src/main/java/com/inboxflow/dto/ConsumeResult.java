package com.inboxflow.dto;

import lombok.*;

/**
 * Outcome of a token bucket consume.
 * retryAfterSeconds is 0 when allowed, otherwise ceil((requested - available) / refillRate).
 */
@Getter @AllArgsConstructor @Builder
public class ConsumeResult {

    private final boolean allowed;
    private final double remainingTokens;
    private final long retryAfterSeconds;

    public static ConsumeResult unlimited(int capacity) {
        return new ConsumeResult(true, capacity, 0);
    }
}
