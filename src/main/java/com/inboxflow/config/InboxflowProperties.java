package com.inboxflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralizes topic names, retry policy, worker sizing and provider settings.
 *
 * Bound from application.yml under the "inboxflow" prefix:
 *   inboxflow:
 *     topics:
 *       webhook-events: inboxflow.webhook-events
 *       message-send: inboxflow.message-send
 *       retry: inboxflow.retry
 *       dead-letter: inboxflow.dead-letter
 *     retry:
 *       max-attempts: 5
 *       base-delay-ms: 2000
 *     webhook:
 *       verify-token: ...
 *
 * Every component that needs a topic, a limit or a secret injects this
 * instead of hardcoding it.
 */
@Component
@ConfigurationProperties(prefix = "inboxflow")
@Getter
@Setter
public class InboxflowProperties {

    private Topics topics = new Topics();
    private Webhook webhook = new Webhook();
    private Processing processing = new Processing();
    private Retry retry = new Retry();
    private Flows flows = new Flows();
    private Dispatch dispatch = new Dispatch();
    private RateLimit rateLimit = new RateLimit();
    private Crypto crypto = new Crypto();

    @Getter
    @Setter
    public static class Topics {
        private String webhookEvents = "inboxflow.webhook-events";
        private String messageSend = "inboxflow.message-send";
        private String retry = "inboxflow.retry";
        private String deadLetter = "inboxflow.dead-letter";
    }

    @Getter
    @Setter
    public static class Webhook {
        /** Shared secret echoed back during the subscription handshake. */
        private String verifyToken;
        /** When set, POST bodies must carry a matching X-Hub-Signature-256. */
        private String appSecret;
        private long queuedMarkerTtlHours = 24;
    }

    @Getter
    @Setter
    public static class Processing {
        private int maxEventsPerSecond = 100;
        private int concurrency = 10;
        /** PENDING raw events older than this are assumed to have lost their job and are re-enqueued. */
        private long recoverAfterMs = 120_000;
        private long recoveryIntervalMs = 60_000;
        private int recoveryBatchSize = 100;
        /** PROCESSING raw events claimed longer ago than this are returned to PENDING. */
        private long staleAfterMs = 300_000;
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 5;
        private long baseDelayMs = 2000;
    }

    @Getter
    @Setter
    public static class Flows {
        private boolean pollerEnabled = true;
        private long pollIntervalMs = 1000;
        private int batchSize = 10;
        private int maxRetries = 3;
        private long minDelayMs = 1000;
        private long maxDelayMs = 300_000;
        private int maxNodeVisits = 500;
        private int workerThreads = 4;
        /** PROCESSING rows older than this are assumed orphaned by a dead worker. */
        private long staleAfterMs = 600_000;
        private long staleCheckIntervalMs = 60_000;
    }

    @Getter
    @Setter
    public static class Dispatch {
        private String baseUrl = "https://graph.facebook.com";
        private String apiVersion = "v18.0";
        private long connectTimeoutMs = 5000;
        private long readTimeoutMs = 30_000;
        private int concurrency = 5;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int defaultMessagesPerMinute = 60;
        private long bucketTtlSeconds = 300;
        private int maxCasAttempts = 5;
    }

    @Getter
    @Setter
    public static class Crypto {
        /** Password the credential encryption key is derived from; at least 32 characters. */
        private String encryptionKey;
    }
}
