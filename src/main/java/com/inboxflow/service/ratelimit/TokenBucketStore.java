package com.inboxflow.service.ratelimit;

import com.inboxflow.dto.ConsumeResult;

/**
 * Shared storage for token buckets. Implementations must make the
 * read-refill-consume-write cycle atomic across instances.
 *
 * Storage failures surface as Spring's DataAccessException; callers decide
 * whether to fail open.
 */
public interface TokenBucketStore {

    ConsumeResult consume(String key, TokenBucket bucket, int tokens);
}
