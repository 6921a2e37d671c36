package com.inboxflow.service.inbound;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.UnresolvedTenantException;
import com.inboxflow.model.RawEvent;
import com.inboxflow.model.RawEventStatus;
import com.inboxflow.repository.RawEventRepository;
import com.inboxflow.service.TenantDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Processes one persisted webhook change.
 *
 * FLOW:
 *   1. Claim the row: PENDING, or FAILED with retries left → PROCESSING.
 *      No row → MissingRecordException. Lost claim → another worker has it, or it is done.
 *      A claim left behind by a dead worker is released by RawEventRecoveryJob.
 *   2. Tenant: stored on the row, else resolved from the routing key and written back
 *   3. Dispatch by change kind:
 *        message_template_status_update → TemplateStatusHandler
 *        messages[]                     → InboundMessageHandler (one transaction each)
 *        statuses[]                     → StatusUpdateHandler
 *   4. PROCESSED, or FAILED with retryCount + 1 and the error rethrown to the queue layer
 *
 * Every handler is idempotent, so re-running a partially processed change is safe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookEventProcessor {

    public enum Outcome {
        PROCESSED,
        SKIPPED
    }

    private final RawEventRepository rawEventRepository;
    private final TenantDirectory tenantDirectory;
    private final InboundMessageHandler inboundMessageHandler;
    private final StatusUpdateHandler statusUpdateHandler;
    private final TemplateStatusHandler templateStatusHandler;
    private final ObjectMapper objectMapper;
    private final InboxflowProperties properties;
    private final Clock clock;

    public Outcome process(UUID rawEventId) {
        int claimed = rawEventRepository.claim(rawEventId, properties.getRetry().getMaxAttempts(),
                clock.instant(), RawEventStatus.PROCESSING, RawEventStatus.PENDING, RawEventStatus.FAILED);

        if (claimed == 0) {
            RawEvent existing = rawEventRepository.findById(rawEventId)
                    .orElseThrow(() -> new MissingRecordException("Raw event", rawEventId));
            log.info("Raw event {} not claimable (status={}, retryCount={}), skipping",
                    rawEventId, existing.getStatus(), existing.getRetryCount());
            return Outcome.SKIPPED;
        }

        RawEvent event = rawEventRepository.findById(rawEventId)
                .orElseThrow(() -> new MissingRecordException("Raw event", rawEventId));

        try {
            UUID tenantId = resolveTenant(event);
            handleChange(tenantId, event.getRoutingKey(), readPayload(event));
            rawEventRepository.markProcessed(rawEventId, RawEventStatus.PROCESSED, clock.instant());
            log.info("Raw event {} processed", rawEventId);
            return Outcome.PROCESSED;
        } catch (RuntimeException e) {
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.error("Raw event {} failed (attempt {}): {}", rawEventId, event.getRetryCount() + 1, error, e);
            rawEventRepository.markFailed(rawEventId, RawEventStatus.FAILED, error);
            throw e;
        }
    }

    /** Attempts made so far, as recorded on the row. */
    public int attemptsMade(UUID rawEventId) {
        return rawEventRepository.findById(rawEventId)
                .map(RawEvent::getRetryCount)
                .orElse(0);
    }

    private UUID resolveTenant(RawEvent event) {
        if (event.getTenantId() != null) {
            return event.getTenantId();
        }
        UUID tenantId = tenantDirectory.resolveTenantId(event.getRoutingKey())
                .orElseThrow(() -> new UnresolvedTenantException(event.getRoutingKey()));
        rawEventRepository.assignTenant(event.getId(), tenantId);
        log.info("Raw event {} resolved to tenant {} on processing", event.getId(), tenantId);
        return tenantId;
    }

    private void handleChange(UUID tenantId, String routingKey, JsonNode change) {
        String field = change.path("field").asText("");
        JsonNode value = change.path("value");

        if (TemplateStatusHandler.FIELD.equals(field)) {
            templateStatusHandler.handle(tenantId, value);
            return;
        }

        JsonNode contacts = value.path("contacts");
        for (JsonNode message : value.path("messages")) {
            inboundMessageHandler.handle(tenantId, routingKey, message,
                    profileName(contacts, message.path("from").asText("")));
        }
        for (JsonNode status : value.path("statuses")) {
            statusUpdateHandler.handle(tenantId, status);
        }
    }

    // The sender's display name sits in value.contacts[], matched by wa_id
    static String profileName(JsonNode contacts, String from) {
        for (JsonNode contact : contacts) {
            if (from.equals(contact.path("wa_id").asText())) {
                String name = contact.path("profile").path("name").asText("");
                return name.isBlank() ? null : name;
            }
        }
        return null;
    }

    private JsonNode readPayload(RawEvent event) {
        try {
            return objectMapper.readTree(event.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored payload of raw event " + event.getId() + " is not JSON", e);
        }
    }
}
