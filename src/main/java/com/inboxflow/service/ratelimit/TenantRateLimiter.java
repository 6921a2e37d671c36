package com.inboxflow.service.ratelimit;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.ConsumeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Per-tenant outbound send quota.
 *
 * Each tenant has one bucket, "inboxflow:rate-limit:tenant:{tenantId}", sized
 * by the tenant's messagesPerMinute (platform default when unset). The bucket
 * lives in Redis, so all dispatch instances draw from the same quota.
 *
 * If Redis is unreachable the limiter fails open: sends keep flowing and the
 * provider's own throttling becomes the backstop.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenantRateLimiter {

    static final String KEY_PREFIX = "inboxflow:rate-limit:tenant:";

    private final TokenBucketStore store;
    private final InboxflowProperties properties;

    public ConsumeResult consume(UUID tenantId, Integer messagesPerMinute, int tokens) {
        int capacity = capacityFor(messagesPerMinute);
        try {
            ConsumeResult result = store.consume(KEY_PREFIX + tenantId, TokenBucket.perMinute(capacity), tokens);
            if (!result.isAllowed()) {
                log.info("Tenant {} over send quota ({}/min), retry after {}s",
                        tenantId, capacity, result.getRetryAfterSeconds());
            }
            return result;
        } catch (DataAccessException e) {
            log.warn("Rate limiter storage unavailable, allowing send for tenant {}: {}", tenantId, e.getMessage());
            return ConsumeResult.unlimited(capacity);
        }
    }

    int capacityFor(Integer messagesPerMinute) {
        if (messagesPerMinute == null || messagesPerMinute <= 0) {
            return properties.getRateLimit().getDefaultMessagesPerMinute();
        }
        return messagesPerMinute;
    }
}
