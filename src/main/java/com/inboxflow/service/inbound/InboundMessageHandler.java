package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.dto.FlowTriggerContext;
import com.inboxflow.dto.InboundContent;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.Contact;
import com.inboxflow.model.Conversation;
import com.inboxflow.model.FlowTriggerType;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageDirection;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.model.MessageType;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.service.ConversationService;
import com.inboxflow.service.RealtimeEventPublisher;
import com.inboxflow.service.flow.FlowTriggerService;
import com.inboxflow.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Stores one inbound message and starts the flows it triggers.
 *
 * FLOW (one transaction):
 *   1. externalMessageId already stored? → DUPLICATE, nothing else happens
 *   2. Upsert Contact and Conversation for (tenant, phone)
 *   3. Classify the content, insert Message(INBOUND, DELIVERED)
 *   4. conversation:new / conversation:updated, then message:new (sent after commit)
 *   5. Flow triggers. A reply to a flow button only resumes that flow. Otherwise:
 *        CONVERSATION_OPENED (new conversation), NEW_MESSAGE, KEYWORD (text messages)
 *
 * The FlowExecution rows from step 5 commit together with the message, so a
 * crash can neither lose a trigger nor fire one for a message that was rolled back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundMessageHandler {

    private final MessageRepository messageRepository;
    private final ConversationService conversationService;
    private final InboundContentClassifier contentClassifier;
    private final FlowTriggerService flowTriggerService;
    private final RealtimeEventPublisher realtimeEventPublisher;

    @Transactional
    public InboundResult handle(UUID tenantId, String routingKey, JsonNode message, String profileName) {
        String externalId = message.path("id").asText("");
        if (externalId.isBlank()) {
            log.warn("Inbound message without id on {}, ignoring", routingKey);
            return InboundResult.IGNORED;
        }
        if (messageRepository.existsByExternalMessageId(externalId)) {
            log.info("Duplicate inbound message {}, skipping", externalId);
            return InboundResult.DUPLICATE;
        }

        String from = PhoneNumbers.normalize(message.path("from").asText(""));
        if (from.isEmpty()) {
            log.warn("Inbound message {} has no sender, ignoring", externalId);
            return InboundResult.IGNORED;
        }
        Instant timestamp = parseTimestamp(message.path("timestamp"));

        Contact contact = conversationService.upsertContact(tenantId, from, profileName);
        ConversationService.ConversationUpsert upsert =
                conversationService.recordInbound(tenantId, from, profileName, timestamp);
        Conversation conversation = upsert.getConversation();

        InboundContent content = contentClassifier.classify(message);
        Message saved = messageRepository.save(Message.builder()
                .tenantId(tenantId)
                .conversationId(conversation.getId())
                .externalMessageId(externalId)
                .direction(MessageDirection.INBOUND)
                .status(MessageStatus.DELIVERED)
                .type(content.getType())
                .from(from)
                .to(routingKey)
                .text(content.getText())
                .mediaId(content.getMediaId())
                .mediaMimeType(content.getMediaMimeType())
                .mediaCaption(content.getMediaCaption())
                .mediaFilename(content.getMediaFilename())
                .interactiveData(content.getInteractiveData())
                .timestamp(timestamp)
                .deliveredAt(timestamp)
                .build());

        log.info("Stored inbound {} message {} from {} in conversation {}",
                content.getType(), externalId, from, conversation.getId());

        publishEvents(tenantId, conversation, saved, upsert.isCreated());
        triggerFlows(tenantId, contact, conversation, content, upsert.isCreated());
        return InboundResult.CREATED;
    }

    private void publishEvents(UUID tenantId, Conversation conversation, Message message, boolean created) {
        Map<String, Object> conversationData = new LinkedHashMap<>();
        conversationData.put("conversationId", conversation.getId());
        conversationData.put("contactPhone", conversation.getContactPhone());
        conversationData.put("unreadCount", conversation.getUnreadCount());
        conversationData.put("lastMessageAt", conversation.getLastMessageAt() == null
                ? null : conversation.getLastMessageAt().toString());
        realtimeEventPublisher.publish(created ? RealtimeEventType.CONVERSATION_NEW : RealtimeEventType.CONVERSATION_UPDATED,
                tenantId, conversationData);

        Map<String, Object> messageData = new LinkedHashMap<>();
        messageData.put("conversationId", conversation.getId());
        messageData.put("messageId", message.getId());
        messageData.put("direction", MessageDirection.INBOUND.name());
        messageData.put("type", message.getType().name());
        realtimeEventPublisher.publish(RealtimeEventType.MESSAGE_NEW, tenantId, messageData);
    }

    private void triggerFlows(UUID tenantId, Contact contact, Conversation conversation,
                              InboundContent content, boolean newConversation) {
        FlowTriggerContext context = FlowTriggerContext.builder()
                .contactPhone(conversation.getContactPhone())
                .messageBody(content.getText())
                .messageType(content.getType().name())
                .contactId(contact.getId())
                .conversationId(conversation.getId())
                .build();

        if (flowTriggerService.isFlowButtonPayload(content.getReplyPayload())) {
            flowTriggerService.handleButtonClick(tenantId, conversation.getContactPhone(),
                    content.getReplyPayload(), context);
            return;
        }

        if (newConversation) {
            flowTriggerService.triggerFlows(tenantId, FlowTriggerType.CONVERSATION_OPENED, context);
        }
        flowTriggerService.triggerFlows(tenantId, FlowTriggerType.NEW_MESSAGE, context);
        if (content.getType() == MessageType.TEXT && content.getText() != null) {
            flowTriggerService.triggerFlows(tenantId, FlowTriggerType.KEYWORD, context);
        }
    }

    // Provider timestamps are epoch seconds as a string
    static Instant parseTimestamp(JsonNode timestamp) {
        try {
            long seconds = Long.parseLong(timestamp.asText(""));
            return Instant.ofEpochSecond(seconds);
        } catch (NumberFormatException e) {
            return Instant.now();
        }
    }
}
