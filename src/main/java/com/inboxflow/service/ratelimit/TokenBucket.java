package com.inboxflow.service.ratelimit;

import com.inboxflow.dto.ConsumeResult;
import lombok.Getter;

/**
 * Token bucket arithmetic, with no storage attached.
 *
 * HOW IT WORKS:
 *   - A bucket holds at most {@code capacity} tokens and refills continuously
 *     at {@code refillPerSecond}.
 *   - Refill is lazy: nothing ticks in the background. Each access adds
 *     elapsed × rate tokens (capped at capacity) and moves lastRefill to now.
 *   - A consume of n succeeds when at least n tokens are available. Otherwise
 *     the state is only refilled and the caller is told how long to wait.
 *
 * Example (60 per minute → 1 token/s):
 *   t=0     state {tokens=0.5}       consume(1) → denied, retryAfter = ceil(0.5 / 1) = 1s
 *   t=0.5s  state {tokens=1.0}       consume(1) → allowed, tokens = 0
 */
@Getter
public class TokenBucket {

    private final int capacity;
    private final double refillPerSecond;

    public TokenBucket(int capacity, double refillPerSecond) {
        if (capacity <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("Bucket capacity and refill rate must be positive");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
    }

    /** Per-tenant send quota: capacity n, refilled n / 60 per second. */
    public static TokenBucket perMinute(int messagesPerMinute) {
        return new TokenBucket(messagesPerMinute, messagesPerMinute / 60.0);
    }

    public static TokenBucket perSecond(int eventsPerSecond) {
        return new TokenBucket(eventsPerSecond, eventsPerSecond);
    }

    /** A bucket seen for the first time starts full. */
    public TokenBucketState initialState(long nowMillis) {
        return new TokenBucketState(capacity, nowMillis);
    }

    public TokenBucketState refill(TokenBucketState state, long nowMillis) {
        // Clock skew between instances must never drain a bucket
        long elapsedMillis = Math.max(0, nowMillis - state.getLastRefill());
        double tokens = Math.min(capacity, state.getTokens() + (elapsedMillis / 1000.0) * refillPerSecond);
        return new TokenBucketState(tokens, Math.max(nowMillis, state.getLastRefill()));
    }

    public Decision tryConsume(TokenBucketState current, int tokens, long nowMillis) {
        TokenBucketState refilled = refill(current, nowMillis);

        if (refilled.getTokens() >= tokens) {
            TokenBucketState after = new TokenBucketState(refilled.getTokens() - tokens, refilled.getLastRefill());
            return new Decision(true, after, 0);
        }

        long retryAfter = (long) Math.ceil((tokens - refilled.getTokens()) / refillPerSecond);
        return new Decision(false, refilled, Math.max(1, retryAfter));
    }

    @Getter
    public static class Decision {

        private final boolean allowed;
        private final TokenBucketState state;
        private final long retryAfterSeconds;

        Decision(boolean allowed, TokenBucketState state, long retryAfterSeconds) {
            this.allowed = allowed;
            this.state = state;
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public ConsumeResult toResult() {
            return ConsumeResult.builder()
                    .allowed(allowed)
                    .remainingTokens(state.getTokens())
                    .retryAfterSeconds(retryAfterSeconds)
                    .build();
        }
    }
}
