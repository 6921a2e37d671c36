package com.inboxflow.service.ratelimit;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.ConsumeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Caps webhook event processing throughput across all instances.
 *
 * Uses the same bucket store as the tenant send quota, with one global bucket
 * of max-events-per-second. A worker that finds the bucket empty waits a
 * fraction of a second and tries again; the event itself is never rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProcessingThrottle {

    static final String KEY = "inboxflow:rate-limit:processing";

    private final TokenBucketStore store;
    private final InboxflowProperties properties;

    public void acquire() {
        int perSecond = properties.getProcessing().getMaxEventsPerSecond();
        if (perSecond <= 0) {
            return;
        }
        TokenBucket bucket = TokenBucket.perSecond(perSecond);
        long pauseMs = Math.max(10, 1000L / perSecond);

        while (true) {
            ConsumeResult result;
            try {
                result = store.consume(KEY, bucket, 1);
            } catch (DataAccessException e) {
                log.warn("Processing throttle unavailable, continuing unthrottled: {}", e.getMessage());
                return;
            }
            if (result.isAllowed()) {
                return;
            }
            try {
                Thread.sleep(pauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
