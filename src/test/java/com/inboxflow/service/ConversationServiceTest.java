package com.inboxflow.service;

import com.inboxflow.model.Conversation;
import com.inboxflow.model.ConversationStatus;
import com.inboxflow.repository.ContactRepository;
import com.inboxflow.repository.ConversationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConversationServiceTest {

    private static final Instant T = Instant.parse("2026-01-15T10:00:00Z");

    @Mock private ContactRepository contactRepository;
    @Mock private ConversationRepository conversationRepository;

    @InjectMocks
    private ConversationService conversationService;

    private final UUID tenantId = UUID.randomUUID();

    @Test
    @DisplayName("A first message opens a conversation with one unread")
    void opensConversation() {
        when(conversationRepository.findByTenantIdAndContactPhone(tenantId, "+1555")).thenReturn(Optional.empty());
        when(conversationRepository.saveAndFlush(any(Conversation.class))).thenAnswer(inv -> inv.getArgument(0));

        ConversationService.ConversationUpsert upsert = conversationService.recordInbound(tenantId, "+1555", "Ada", T);

        assertTrue(upsert.isCreated());
        assertEquals(1, upsert.getConversation().getUnreadCount());
        assertEquals(ConversationStatus.OPEN, upsert.getConversation().getStatus());
        assertEquals(T, upsert.getConversation().getLastMessageAt());
    }

    @Test
    @DisplayName("An existing conversation is updated by the atomic UPDATE, not by saving a stale copy")
    void existingConversationUsesAtomicUpdate() {
        UUID id = UUID.randomUUID();
        Conversation existing = Conversation.builder()
                .id(id).tenantId(tenantId).contactPhone("+1555").lastMessageAt(T).unreadCount(2).build();
        Conversation reloaded = Conversation.builder()
                .id(id).tenantId(tenantId).contactPhone("+1555").lastMessageAt(T).unreadCount(3).build();
        when(conversationRepository.findByTenantIdAndContactPhone(tenantId, "+1555")).thenReturn(Optional.of(existing));
        when(conversationRepository.findById(id)).thenReturn(Optional.of(reloaded));

        ConversationService.ConversationUpsert upsert =
                conversationService.recordInbound(tenantId, "+1555", "  ", T.minusSeconds(60));

        assertFalse(upsert.isCreated());
        assertSame(reloaded, upsert.getConversation());
        // A blank profile name must not overwrite the stored one
        verify(conversationRepository).recordInbound(id, T.minusSeconds(60), null,
                ConversationStatus.CLOSED, ConversationStatus.OPEN);
        verify(conversationRepository, never()).save(any());
    }

    @Test
    @DisplayName("Two workers that both read unread=5 end with unread=7")
    void concurrentInboundMessagesBothCount() {
        UUID id = UUID.randomUUID();
        AtomicInteger unreadInDatabase = new AtomicInteger(5);
        // Each worker reads its own copy of the committed row, as two transactions would
        when(conversationRepository.findByTenantIdAndContactPhone(tenantId, "+1555"))
                .thenAnswer(inv -> Optional.of(Conversation.builder()
                        .id(id).tenantId(tenantId).contactPhone("+1555").lastMessageAt(T).unreadCount(5).build()));
        when(conversationRepository.recordInbound(eq(id), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    unreadInDatabase.incrementAndGet();
                    return 1;
                });
        when(conversationRepository.findById(id))
                .thenAnswer(inv -> Optional.of(Conversation.builder()
                        .id(id).tenantId(tenantId).contactPhone("+1555").unreadCount(unreadInDatabase.get()).build()));

        conversationService.recordInbound(tenantId, "+1555", null, T.plusSeconds(1));
        ConversationService.ConversationUpsert second =
                conversationService.recordInbound(tenantId, "+1555", null, T.plusSeconds(2));

        assertEquals(7, unreadInDatabase.get());
        assertEquals(7, second.getConversation().getUnreadCount());
        verify(conversationRepository, never()).save(any());
    }
}
