package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.FlowTriggerContext;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.Contact;
import com.inboxflow.model.Conversation;
import com.inboxflow.model.ConversationStatus;
import com.inboxflow.model.FlowTriggerType;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageDirection;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.model.MessageType;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.service.ConversationService;
import com.inboxflow.service.RealtimeEventPublisher;
import com.inboxflow.service.flow.FlowTriggerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for InboundMessageHandler.
 *
 * Verifies:
 *   1. A redelivered provider message id is a no-op
 *   2. The stored message is INBOUND/DELIVERED with the provider timestamp
 *   3. Which flow triggers fire for new vs existing conversations
 *   4. A flow button reply resumes the flow and fires nothing else
 */
@ExtendWith(MockitoExtension.class)
class InboundMessageHandlerTest {

    @Mock private MessageRepository messageRepository;
    @Mock private ConversationService conversationService;
    @Mock private FlowTriggerService flowTriggerService;
    @Mock private RealtimeEventPublisher realtimeEventPublisher;
    @Spy  private InboundContentClassifier contentClassifier = new InboundContentClassifier();

    @InjectMocks
    private InboundMessageHandler handler;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID tenantId = UUID.randomUUID();
    private Contact contact;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        contact = Contact.builder().id(UUID.randomUUID()).tenantId(tenantId).phone("+15551234567").build();
        conversation = Conversation.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .contactPhone("+15551234567")
                .status(ConversationStatus.OPEN)
                .unreadCount(1)
                .build();
    }

    private JsonNode textMessage(String id, String body) throws Exception {
        return objectMapper.readTree("{\"id\":\"" + id + "\",\"from\":\"15551234567\",\"timestamp\":\"1700000000\","
                + "\"type\":\"text\",\"text\":{\"body\":\"" + body + "\"}}");
    }

    private void givenConversation(boolean created) {
        when(messageRepository.existsByExternalMessageId(anyString())).thenReturn(false);
        when(conversationService.upsertContact(tenantId, "+15551234567", "Ada")).thenReturn(contact);
        when(conversationService.recordInbound(eq(tenantId), eq("+15551234567"), eq("Ada"), any(Instant.class)))
                .thenReturn(new ConversationService.ConversationUpsert(conversation, created));
        when(messageRepository.save(any(Message.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("A message id seen before is a no-op")
    void duplicateIsNoOp() throws Exception {
        when(messageRepository.existsByExternalMessageId("wamid.1")).thenReturn(true);

        InboundResult result = handler.handle(tenantId, "pn-1", textMessage("wamid.1", "hi"), "Ada");

        assertEquals(InboundResult.DUPLICATE, result);
        verifyNoInteractions(conversationService, flowTriggerService, realtimeEventPublisher);
        verify(messageRepository, never()).save(any());
    }

    @Test
    @DisplayName("A message without an id is ignored")
    void missingIdIgnored() throws Exception {
        JsonNode message = objectMapper.readTree("{\"from\":\"15551234567\",\"text\":{\"body\":\"hi\"}}");

        assertEquals(InboundResult.IGNORED, handler.handle(tenantId, "pn-1", message, "Ada"));
        verifyNoInteractions(messageRepository);
    }

    @Test
    @DisplayName("Stores an inbound text as DELIVERED at the provider timestamp")
    void storesInboundMessage() throws Exception {
        givenConversation(false);

        InboundResult result = handler.handle(tenantId, "pn-1", textMessage("wamid.2", "need help"), "Ada");

        assertEquals(InboundResult.CREATED, result);
        ArgumentCaptor<Message> saved = ArgumentCaptor.forClass(Message.class);
        verify(messageRepository).save(saved.capture());
        Message message = saved.getValue();
        assertEquals(MessageDirection.INBOUND, message.getDirection());
        assertEquals(MessageStatus.DELIVERED, message.getStatus());
        assertEquals(MessageType.TEXT, message.getType());
        assertEquals("need help", message.getText());
        assertEquals("+15551234567", message.getFrom());
        assertEquals("pn-1", message.getTo());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), message.getTimestamp());
        assertEquals(conversation.getId(), message.getConversationId());
    }

    @Test
    @DisplayName("A new conversation fires CONVERSATION_OPENED, NEW_MESSAGE and KEYWORD")
    void newConversationTriggers() throws Exception {
        givenConversation(true);

        handler.handle(tenantId, "pn-1", textMessage("wamid.3", "need help"), "Ada");

        verify(flowTriggerService).triggerFlows(eq(tenantId), eq(FlowTriggerType.CONVERSATION_OPENED), any());
        verify(flowTriggerService).triggerFlows(eq(tenantId), eq(FlowTriggerType.NEW_MESSAGE), any());
        verify(flowTriggerService).triggerFlows(eq(tenantId), eq(FlowTriggerType.KEYWORD), any());
        verify(realtimeEventPublisher).publish(eq(RealtimeEventType.CONVERSATION_NEW), eq(tenantId), anyMap());
        verify(realtimeEventPublisher).publish(eq(RealtimeEventType.MESSAGE_NEW), eq(tenantId), anyMap());
    }

    @Test
    @DisplayName("An existing conversation does not fire CONVERSATION_OPENED")
    void existingConversationTriggers() throws Exception {
        givenConversation(false);

        handler.handle(tenantId, "pn-1", textMessage("wamid.4", "hello"), "Ada");

        verify(flowTriggerService, never()).triggerFlows(any(), eq(FlowTriggerType.CONVERSATION_OPENED), any());
        verify(flowTriggerService).triggerFlows(eq(tenantId), eq(FlowTriggerType.NEW_MESSAGE), any());
        verify(realtimeEventPublisher).publish(eq(RealtimeEventType.CONVERSATION_UPDATED), eq(tenantId), anyMap());
    }

    @Test
    @DisplayName("A flow button reply resumes the flow and triggers nothing else")
    void buttonReplyResumes() throws Exception {
        givenConversation(false);
        String payload = "flow-" + UUID.randomUUID() + "-node-n1-btn-yes";
        when(flowTriggerService.isFlowButtonPayload(payload)).thenReturn(true);
        JsonNode message = objectMapper.readTree("{\"id\":\"wamid.5\",\"from\":\"15551234567\",\"timestamp\":\"1700000000\","
                + "\"type\":\"interactive\",\"interactive\":{\"type\":\"button_reply\","
                + "\"button_reply\":{\"id\":\"" + payload + "\",\"title\":\"Yes\"}}}");

        handler.handle(tenantId, "pn-1", message, "Ada");

        ArgumentCaptor<FlowTriggerContext> context = ArgumentCaptor.forClass(FlowTriggerContext.class);
        verify(flowTriggerService).handleButtonClick(eq(tenantId), eq("+15551234567"), eq(payload), context.capture());
        assertEquals("Yes", context.getValue().getMessageBody());
        verify(flowTriggerService, never()).triggerFlows(any(), any(), any());
    }

    @Test
    @DisplayName("Unparseable timestamps fall back to now")
    void timestampFallback() throws Exception {
        Instant before = Instant.now();

        Instant parsed = InboundMessageHandler.parseTimestamp(objectMapper.readTree("\"soon\""));

        assertFalse(parsed.isBefore(before));
    }
}
