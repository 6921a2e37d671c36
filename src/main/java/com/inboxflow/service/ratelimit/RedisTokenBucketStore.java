package com.inboxflow.service.ratelimit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.ConsumeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Token buckets kept in Redis as JSON strings, updated with optimistic locking.
 *
 * HOW IT WORKS:
 *   1. WATCH the bucket key
 *   2. GET the state (absent → a full bucket) and compute the decision locally
 *   3. Denied → UNWATCH, nothing to write
 *      Allowed → MULTI, SET state with TTL, EXEC
 *   4. EXEC returns nothing when another instance touched the key in between.
 *      The whole cycle is then repeated, up to max-cas-attempts times.
 *
 * A bucket that is not touched for bucket-ttl-seconds expires; it would be
 * full again by then anyway.
 *
 * The callback talks to the template field rather than the operations argument:
 * execute(SessionCallback) binds one connection to the thread, so both reach the
 * same connection, and the field is already typed for String keys.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisTokenBucketStore implements TokenBucketStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final InboxflowProperties properties;
    private final Clock clock;

    @Override
    public ConsumeResult consume(String key, TokenBucket bucket, int tokens) {
        int maxAttempts = properties.getRateLimit().getMaxCasAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<ConsumeResult> result = redisTemplate.execute(new ConsumeCallback(key, bucket, tokens));
            if (result != null && result.isPresent()) {
                return result.get();
            }
            log.debug("Bucket {} changed concurrently, retrying (attempt {}/{})", key, attempt, maxAttempts);
        }

        // Heavy contention: treat as momentarily empty rather than over-admitting
        log.warn("Gave up updating bucket {} after {} attempts", key, maxAttempts);
        return ConsumeResult.builder()
                .allowed(false)
                .remainingTokens(0)
                .retryAfterSeconds(1)
                .build();
    }

    private TokenBucketState readState(String raw, TokenBucket bucket, long now) {
        if (raw == null) {
            return bucket.initialState(now);
        }
        try {
            return objectMapper.readValue(raw, TokenBucketState.class);
        } catch (JsonProcessingException e) {
            log.warn("Corrupt bucket state '{}', starting from a full bucket", raw);
            return bucket.initialState(now);
        }
    }

    private String writeState(TokenBucketState state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize bucket state", e);
        }
    }

    private class ConsumeCallback implements SessionCallback<Optional<ConsumeResult>> {

        private final String key;
        private final TokenBucket bucket;
        private final int tokens;

        ConsumeCallback(String key, TokenBucket bucket, int tokens) {
            this.key = key;
            this.bucket = bucket;
            this.tokens = tokens;
        }

        @Override
        public <K, V> Optional<ConsumeResult> execute(RedisOperations<K, V> operations) throws DataAccessException {
            StringRedisTemplate ops = redisTemplate;

            ops.watch(key);
            long now = clock.millis();
            TokenBucketState current = readState(ops.opsForValue().get(key), bucket, now);
            TokenBucket.Decision decision = bucket.tryConsume(current, tokens, now);

            if (!decision.isAllowed()) {
                ops.unwatch();
                return Optional.of(decision.toResult());
            }

            ops.multi();
            ops.opsForValue().set(key, writeState(decision.getState()),
                    Duration.ofSeconds(properties.getRateLimit().getBucketTtlSeconds()));
            List<Object> committed = ops.exec();

            if (committed == null || committed.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(decision.toResult());
        }
    }
}
