package com.inboxflow.service.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Persisted bucket state.
 *
 * Example JSON (Redis value):
 *   {"tokens": 42.5, "lastRefill": 1732101010000}
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TokenBucketState {

    private double tokens;
    // Epoch millis of the last refill
    private long lastRefill;
}
