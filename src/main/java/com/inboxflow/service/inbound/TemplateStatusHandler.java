package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.MessageTemplate;
import com.inboxflow.model.TemplateStatus;
import com.inboxflow.repository.MessageTemplateRepository;
import com.inboxflow.service.RealtimeEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Handles {@code message_template_status_update} changes.
 *
 * Example value:
 *   {"event":"REJECTED","message_template_id":1234567890,
 *    "message_template_name":"order_update","message_template_language":"en_US",
 *    "reason":"INVALID_FORMAT"}
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TemplateStatusHandler {

    public static final String FIELD = "message_template_status_update";

    private final MessageTemplateRepository templateRepository;
    private final RealtimeEventPublisher realtimeEventPublisher;

    @Transactional
    public boolean handle(UUID tenantId, JsonNode value) {
        String externalId = text(value, "message_template_id");
        String name = text(value, "message_template_name");
        String language = text(value, "message_template_language");
        String event = value.path("event").asText("");

        Optional<TemplateStatus> status = parseStatus(event);
        if (status.isEmpty()) {
            log.warn("Unknown template event '{}' for template {}, ignoring", event, externalId);
            return false;
        }

        Optional<MessageTemplate> found = Optional.empty();
        if (externalId != null) {
            found = templateRepository.findByTenantIdAndExternalId(tenantId, externalId);
        }
        if (found.isEmpty() && name != null && language != null) {
            found = templateRepository.findByTenantIdAndNameAndLanguage(tenantId, name, language);
        }
        if (found.isEmpty()) {
            log.warn("Status update for unknown template {} ({}/{}) of tenant {}, ignoring",
                    externalId, name, language, tenantId);
            return false;
        }

        MessageTemplate template = found.get();
        String reason = text(value, "reason");
        template.setStatus(status.get());
        template.setRejectionReason(reason == null || "NONE".equalsIgnoreCase(reason) ? null : reason);
        if (template.getExternalId() == null) {
            template.setExternalId(externalId);
        }
        templateRepository.save(template);
        log.info("Template '{}' ({}) of tenant {} is now {}", template.getName(), template.getLanguage(),
                tenantId, status.get());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", "template_status");
        data.put("templateId", template.getId());
        data.put("name", template.getName());
        data.put("status", status.get().name());
        data.put("reason", template.getRejectionReason());
        realtimeEventPublisher.publish(RealtimeEventType.NOTIFICATION_NEW, tenantId, data);
        return true;
    }

    static Optional<TemplateStatus> parseStatus(String event) {
        try {
            return Optional.of(TemplateStatus.valueOf(event.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText();
    }
}
