package com.inboxflow.service.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.exception.ProviderRejectionException;
import com.inboxflow.model.Message;
import com.inboxflow.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the provider's send request body for a stored outbound message.
 *
 * Example (text):
 *   {"messaging_product":"whatsapp","recipient_type":"individual","to":"15551234567",
 *    "type":"text","text":{"body":"Hello"}}
 *
 * Example (template with two body parameters):
 *   {"messaging_product":"whatsapp", ..., "type":"template",
 *    "template":{"name":"order_update","language":{"code":"en_US"},
 *                "components":[{"type":"body","parameters":[{"type":"text","text":"A-1"},
 *                                                           {"type":"text","text":"Friday"}]}]}}
 */
@Component
@RequiredArgsConstructor
public class ProviderPayloadBuilder {

    private final ObjectMapper objectMapper;

    public Map<String, Object> build(Message message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messaging_product", "whatsapp");
        payload.put("recipient_type", "individual");
        payload.put("to", PhoneNumbers.toProviderFormat(message.getTo()));

        switch (message.getType()) {
            case TEXT -> {
                payload.put("type", "text");
                payload.put("text", Map.of("body", required(message.getText(), message, "text")));
            }
            case IMAGE, VIDEO -> {
                String type = message.getType().name().toLowerCase(Locale.ROOT);
                payload.put("type", type);
                payload.put(type, media(message, true, false));
            }
            case AUDIO -> {
                payload.put("type", "audio");
                payload.put("audio", media(message, false, false));
            }
            case DOCUMENT -> {
                payload.put("type", "document");
                payload.put("document", media(message, true, true));
            }
            case TEMPLATE -> {
                payload.put("type", "template");
                payload.put("template", template(message));
            }
            case INTERACTIVE -> {
                payload.put("type", "interactive");
                payload.put("interactive", readTree(required(message.getInteractiveData(), message, "interactiveData"),
                        message, "interactiveData"));
            }
            default -> throw badParameter(message, "Unsupported outbound message type: " + message.getType());
        }
        return payload;
    }

    private Map<String, Object> media(Message message, boolean withCaption, boolean withFilename) {
        Map<String, Object> media = new LinkedHashMap<>();
        media.put("link", required(message.getMediaUrl(), message, "mediaUrl"));
        if (withCaption && message.getMediaCaption() != null) {
            media.put("caption", message.getMediaCaption());
        }
        if (withFilename && message.getMediaFilename() != null) {
            media.put("filename", message.getMediaFilename());
        }
        return media;
    }

    private Map<String, Object> template(Message message) {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("name", required(message.getTemplateName(), message, "templateName"));
        template.put("language", Map.of("code",
                message.getTemplateLanguage() == null ? "en_US" : message.getTemplateLanguage()));

        List<String> params = templateParams(message);
        if (!params.isEmpty()) {
            List<Map<String, Object>> parameters = new ArrayList<>();
            for (String param : params) {
                parameters.add(Map.of("type", "text", "text", param));
            }
            template.put("components", List.of(Map.of("type", "body", "parameters", parameters)));
        }
        return template;
    }

    private List<String> templateParams(Message message) {
        if (message.getTemplateParams() == null || message.getTemplateParams().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(message.getTemplateParams(), new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            throw badParameter(message, "templateParams is not a JSON array of strings");
        }
    }

    private JsonNode readTree(String json, Message message, String field) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw badParameter(message, field + " is not valid JSON");
        }
    }

    private static String required(String value, Message message, String field) {
        if (value == null || value.isBlank()) {
            throw badParameter(message, field + " is required for " + message.getType() + " messages");
        }
        return value;
    }

    private static ProviderRejectionException badParameter(Message message, String reason) {
        return new ProviderRejectionException(ProviderRejectionException.Kind.BAD_PARAMETER, 0, null,
                "Message " + message.getId() + ": " + reason);
    }
}
