package com.inboxflow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.model.RawEvent;
import com.inboxflow.repository.RawEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable receipt of provider webhooks. Nothing here interprets the content:
 * each change is stored as-is and handed to the processing queue.
 *
 * Routing key per change:
 *   value.metadata.routing_key → value.metadata.phone_number_id → entry.id
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    public static final String SUBSCRIBE_MODE = "subscribe";

    private final RawEventRepository rawEventRepository;
    private final TenantDirectory tenantDirectory;
    private final JobQueueService jobQueueService;
    private final InboxflowProperties properties;

    /** Subscription handshake: mode must be "subscribe" and the token must match. */
    public boolean verifySubscription(String mode, String token) {
        String expected = properties.getWebhook().getVerifyToken();
        if (!SUBSCRIBE_MODE.equals(mode) || token == null || expected == null || expected.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Persists and enqueues every change in the body.
     * Failures are logged per change and never propagate: the provider always gets its 200.
     *
     * @return number of changes persisted
     */
    public int ingest(JsonNode body) {
        int persisted = 0;
        for (JsonNode entry : body.path("entry")) {
            for (JsonNode change : entry.path("changes")) {
                if (ingestChange(entry, change)) {
                    persisted++;
                }
            }
        }
        log.info("Webhook received: {} change(s) persisted", persisted);
        return persisted;
    }

    private boolean ingestChange(JsonNode entry, JsonNode change) {
        String routingKey = routingKey(entry, change);
        if (routingKey == null) {
            log.warn("Webhook change without routing key (field={}), skipping", change.path("field").asText());
            return false;
        }

        UUID tenantId = resolveTenantQuietly(routingKey);
        RawEvent event;
        try {
            event = rawEventRepository.save(RawEvent.builder()
                    .tenantId(tenantId)
                    .routingKey(routingKey)
                    .payload(change.toString())
                    .build());
        } catch (Exception e) {
            log.error("Failed to persist webhook change for {}: {}", routingKey, e.getMessage(), e);
            return false;
        }

        try {
            jobQueueService.enqueueWebhookEvent(event.getId(), tenantId);
        } catch (Exception e) {
            // The row stays PENDING; the recovery job re-enqueues it
            log.error("Failed to enqueue raw event {}: {}", event.getId(), e.getMessage(), e);
        }
        return true;
    }

    static String routingKey(JsonNode entry, JsonNode change) {
        JsonNode metadata = change.path("value").path("metadata");
        return firstText(metadata.path("routing_key"), metadata.path("phone_number_id"), entry.path("id"))
                .orElse(null);
    }

    private UUID resolveTenantQuietly(String routingKey) {
        try {
            return tenantDirectory.resolveTenantId(routingKey).orElse(null);
        } catch (Exception e) {
            log.warn("Tenant lookup for {} failed, deferring to processing: {}", routingKey, e.getMessage());
            return null;
        }
    }

    private static Optional<String> firstText(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate.isValueNode() && !candidate.asText().isBlank()) {
                return Optional.of(candidate.asText());
            }
        }
        return Optional.empty();
    }
}
