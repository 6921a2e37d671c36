package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.dto.InboundContent;
import com.inboxflow.model.MessageType;
import org.springframework.stereotype.Component;

/**
 * Turns the provider's message object into an {@link InboundContent}.
 *
 * The kind is decided by which body object is present:
 *   text        → TEXT          text.body
 *   image/video → IMAGE/VIDEO   media id, mime type, caption
 *   audio       → AUDIO         media id, mime type
 *   document    → DOCUMENT      media id, mime type, caption, filename
 *   location    → LOCATION      "Location: lat, lng" (+ name / address when given)
 *   contacts    → CONTACT       "Contact shared: {formatted name}"
 *   interactive → INTERACTIVE   button_reply / list_reply: title as text, id as reply payload
 *   button      → BUTTON        template quick reply: text as text, payload as reply payload
 *   anything else → UNKNOWN
 */
@Component
public class InboundContentClassifier {

    public InboundContent classify(JsonNode message) {
        if (message.hasNonNull("text")) {
            return InboundContent.builder()
                    .type(MessageType.TEXT)
                    .text(textOrNull(message.path("text"), "body"))
                    .build();
        }
        if (message.hasNonNull("image")) {
            return media(MessageType.IMAGE, message.path("image"));
        }
        if (message.hasNonNull("video")) {
            return media(MessageType.VIDEO, message.path("video"));
        }
        if (message.hasNonNull("audio")) {
            return media(MessageType.AUDIO, message.path("audio"));
        }
        if (message.hasNonNull("document")) {
            JsonNode document = message.path("document");
            InboundContent content = media(MessageType.DOCUMENT, document);
            content.setMediaFilename(textOrNull(document, "filename"));
            content.setText(content.getMediaFilename());
            return content;
        }
        if (message.hasNonNull("location")) {
            return location(message.path("location"));
        }
        if (message.hasNonNull("contacts")) {
            String name = message.path("contacts").path(0).path("name").path("formatted_name").asText("");
            return InboundContent.builder()
                    .type(MessageType.CONTACT)
                    .text(name.isBlank() ? "Contact shared" : "Contact shared: " + name)
                    .build();
        }
        if (message.hasNonNull("interactive")) {
            return interactive(message.path("interactive"));
        }
        if (message.hasNonNull("button")) {
            JsonNode button = message.path("button");
            return InboundContent.builder()
                    .type(MessageType.BUTTON)
                    .text(textOrNull(button, "text"))
                    .replyPayload(textOrNull(button, "payload"))
                    .build();
        }
        return InboundContent.builder()
                .type(MessageType.UNKNOWN)
                .build();
    }

    private InboundContent media(MessageType type, JsonNode media) {
        String caption = textOrNull(media, "caption");
        return InboundContent.builder()
                .type(type)
                .text(caption)
                .mediaId(textOrNull(media, "id"))
                .mediaMimeType(textOrNull(media, "mime_type"))
                .mediaCaption(caption)
                .build();
    }

    private InboundContent location(JsonNode location) {
        StringBuilder text = new StringBuilder("Location: ")
                .append(location.path("latitude").asText())
                .append(", ")
                .append(location.path("longitude").asText());
        String name = textOrNull(location, "name");
        String address = textOrNull(location, "address");
        if (name != null) {
            text.append(" (").append(name).append(')');
        }
        if (address != null) {
            text.append(" - ").append(address);
        }
        return InboundContent.builder()
                .type(MessageType.LOCATION)
                .text(text.toString())
                .build();
    }

    private InboundContent interactive(JsonNode interactive) {
        String kind = interactive.path("type").asText("");
        JsonNode reply = "list_reply".equals(kind)
                ? interactive.path("list_reply")
                : interactive.path("button_reply");
        return InboundContent.builder()
                .type(MessageType.INTERACTIVE)
                .text(textOrNull(reply, "title"))
                .replyPayload(textOrNull(reply, "id"))
                .interactiveData(interactive.toString())
                .build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
