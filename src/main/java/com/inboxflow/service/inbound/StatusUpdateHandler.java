package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.service.RealtimeEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies delivery receipts ({@code statuses[]}) to outbound messages.
 *
 * Receipts can arrive late, twice, or out of order, so only forward moves are
 * applied (see {@link MessageStatus#canTransitionTo}). A "delivered" after a
 * "read" changes nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatusUpdateHandler {

    private final MessageRepository messageRepository;
    private final RealtimeEventPublisher realtimeEventPublisher;

    /** @return true if the message changed */
    @Transactional
    public boolean handle(UUID tenantId, JsonNode status) {
        String externalId = status.path("id").asText("");
        String rawStatus = status.path("status").asText("");

        Optional<MessageStatus> next = mapStatus(rawStatus);
        if (next.isEmpty()) {
            log.warn("Unknown status '{}' for message {}, ignoring", rawStatus, externalId);
            return false;
        }

        Optional<Message> found = messageRepository.findByExternalMessageId(externalId);
        if (found.isEmpty()) {
            log.warn("Status '{}' for unknown message {}, ignoring", rawStatus, externalId);
            return false;
        }
        Message message = found.get();
        if (!message.getTenantId().equals(tenantId)) {
            log.warn("Status for message {} arrived on tenant {} but belongs to {}, ignoring",
                    externalId, tenantId, message.getTenantId());
            return false;
        }

        MessageStatus target = next.get();
        if (!message.getStatus().canTransitionTo(target)) {
            log.debug("Ignoring {} → {} for message {}", message.getStatus(), target, externalId);
            return false;
        }

        Instant at = InboundMessageHandler.parseTimestamp(status.path("timestamp"));
        message.setStatus(target);
        switch (target) {
            case SENT -> {
                if (message.getSentAt() == null) {
                    message.setSentAt(at);
                }
            }
            case DELIVERED -> message.setDeliveredAt(at);
            case READ -> {
                if (message.getDeliveredAt() == null) {
                    message.setDeliveredAt(at);
                }
                message.setReadAt(at);
            }
            case FAILED -> {
                message.setFailedAt(at);
                message.setErrorMessage(errorText(status.path("errors")));
            }
            default -> {
            }
        }
        messageRepository.save(message);
        log.info("Message {} is now {}", externalId, target);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", message.getConversationId());
        data.put("messageId", message.getId());
        data.put("status", target.name());
        realtimeEventPublisher.publish(RealtimeEventType.CONVERSATION_UPDATED, tenantId, data);
        return true;
    }

    static Optional<MessageStatus> mapStatus(String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "sent" -> Optional.of(MessageStatus.SENT);
            case "delivered" -> Optional.of(MessageStatus.DELIVERED);
            case "read" -> Optional.of(MessageStatus.READ);
            case "failed" -> Optional.of(MessageStatus.FAILED);
            default -> Optional.empty();
        };
    }

    private static String errorText(JsonNode errors) {
        JsonNode first = errors.path(0);
        String title = first.path("title").asText("");
        if (!title.isBlank()) {
            return title;
        }
        String message = first.path("message").asText("");
        return message.isBlank() ? "Unknown error" : message;
    }
}
