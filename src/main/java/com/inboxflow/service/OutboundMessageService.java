package com.inboxflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inboxflow.dto.OutboundMessageRequest;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.Conversation;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageDirection;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.model.MessageType;
import com.inboxflow.model.flow.FlowButton;
import com.inboxflow.model.flow.MessageNode;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.service.flow.ExecutionContext;
import com.inboxflow.service.flow.FlowTriggerService;
import com.inboxflow.service.util.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The one way an outbound message enters the system, whether from the API or a flow.
 *
 * FLOW:
 *   validate → find/open conversation → Message(OUTBOUND, PENDING)
 *            → "message:new" → send job on the message-send topic (after commit)
 *
 * The actual provider call happens later in the dispatcher, so every outbound
 * message gets the tenant quota, retries and the failure taxonomy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboundMessageService {

    static final int MAX_BUTTON_TITLE = 20;
    static final String DEFAULT_BUTTON_PROMPT = "Please select an option:";
    static final String DEFAULT_TEMPLATE_LANGUAGE = "en_US";

    private final ConversationService conversationService;
    private final MessageRepository messageRepository;
    private final JobQueueService jobQueueService;
    private final RealtimeEventPublisher realtimeEventPublisher;
    private final ObjectMapper objectMapper;

    @Transactional
    public Message queue(UUID tenantId, OutboundMessageRequest request) {
        validate(request);
        String to = PhoneNumbers.normalize(request.getTo());
        if (to.isEmpty()) {
            throw new IllegalArgumentException("Recipient is not a phone number: " + request.getTo());
        }

        Conversation conversation = conversationService.findOrOpen(tenantId, to);

        Message message = messageRepository.save(Message.builder()
                .tenantId(tenantId)
                .conversationId(conversation.getId())
                .direction(MessageDirection.OUTBOUND)
                .status(MessageStatus.PENDING)
                .type(request.getType())
                .to(to)
                .text(request.getText())
                .mediaUrl(request.getMediaUrl())
                .mediaCaption(request.getMediaCaption())
                .mediaFilename(request.getMediaFilename())
                .templateName(request.getTemplateName())
                .templateLanguage(request.getType() == MessageType.TEMPLATE
                        ? Optional.ofNullable(request.getTemplateLanguage()).orElse(DEFAULT_TEMPLATE_LANGUAGE)
                        : null)
                .templateParams(request.getTemplateParams() == null ? null : toJson(request.getTemplateParams()))
                .interactiveData(request.getInteractiveData())
                .build());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", conversation.getId());
        data.put("messageId", message.getId());
        data.put("direction", MessageDirection.OUTBOUND.name());
        realtimeEventPublisher.publish(RealtimeEventType.MESSAGE_NEW, tenantId, data);

        UUID messageId = message.getId();
        UUID conversationId = conversation.getId();
        afterCommit(() -> jobQueueService.enqueueMessageSend(messageId, tenantId, conversationId));
        log.info("Queued {} message {} to {} (conversation {})",
                message.getType(), message.getId(), to, conversation.getId());
        return message;
    }

    /**
     * Sends a flow Message node to the execution's contact. With buttons the
     * message is interactive and every reply id encodes where to resume.
     * A node with neither content nor buttons sends nothing.
     */
    @Transactional
    public Optional<Message> queueFlowMessage(ExecutionContext context, MessageNode node) {
        boolean hasContent = node.getContent() != null && !node.getContent().isBlank();
        if (!hasContent && !node.hasButtons()) {
            log.warn("Message node {} of flow {} has no content, nothing sent", node.getId(), context.getFlowId());
            return Optional.empty();
        }

        OutboundMessageRequest request;
        if (node.hasButtons()) {
            request = OutboundMessageRequest.builder()
                    .to(context.getContactPhone())
                    .type(MessageType.INTERACTIVE)
                    .text(hasContent ? node.getContent() : DEFAULT_BUTTON_PROMPT)
                    .interactiveData(buttonsJson(context, node, hasContent ? node.getContent() : DEFAULT_BUTTON_PROMPT))
                    .build();
        } else {
            request = OutboundMessageRequest.builder()
                    .to(context.getContactPhone())
                    .type(MessageType.TEXT)
                    .text(node.getContent())
                    .build();
        }
        return Optional.of(queue(context.getTenantId(), request));
    }

    private String buttonsJson(ExecutionContext context, MessageNode node, String body) {
        ObjectNode interactive = objectMapper.createObjectNode();
        interactive.put("type", "button");
        interactive.putObject("body").put("text", body);
        ArrayNode buttons = interactive.putObject("action").putArray("buttons");
        for (FlowButton button : node.getButtons()) {
            ObjectNode reply = buttons.addObject().put("type", "reply").putObject("reply");
            reply.put("id", FlowTriggerService.buttonPayload(context.getFlowId(), node.getId(), button.getId()));
            reply.put("title", truncate(button.getLabel(), MAX_BUTTON_TITLE));
        }
        return interactive.toString();
    }

    // The dispatcher must never see a job for a message that is not committed yet
    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void validate(OutboundMessageRequest request) {
        MessageType type = request.getType();
        if (type == null) {
            throw new IllegalArgumentException("Message type is required");
        }
        switch (type) {
            case TEXT -> require(request.getText(), "text is required for TEXT messages");
            case IMAGE, VIDEO, AUDIO, DOCUMENT -> require(request.getMediaUrl(), "mediaUrl is required for " + type + " messages");
            case TEMPLATE -> require(request.getTemplateName(), "templateName is required for TEMPLATE messages");
            case INTERACTIVE -> require(request.getInteractiveData(), "interactiveData is required for INTERACTIVE messages");
            default -> throw new IllegalArgumentException("Cannot send messages of type " + type);
        }
    }

    private static void require(String value, String error) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(error);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize message field", e);
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
