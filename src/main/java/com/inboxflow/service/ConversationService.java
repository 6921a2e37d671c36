package com.inboxflow.service;

import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.model.Contact;
import com.inboxflow.model.Conversation;
import com.inboxflow.model.ConversationStatus;
import com.inboxflow.repository.ContactRepository;
import com.inboxflow.repository.ConversationRepository;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Upserts of contacts and conversations, keyed by (tenant, phone).
 *
 * New rows are flushed straight away, so a concurrent insert for the same key
 * fails inside the caller's transaction (unique constraint). The whole job then
 * fails and is retried. On the retry the row exists and the update path runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationService {

    private final ContactRepository contactRepository;
    private final ConversationRepository conversationRepository;

    @Transactional
    public Contact upsertContact(UUID tenantId, String phone, String name) {
        return contactRepository.findByTenantIdAndPhone(tenantId, phone)
                .map(existing -> {
                    if (hasText(name) && !name.equals(existing.getName())) {
                        existing.setName(name);
                        return contactRepository.save(existing);
                    }
                    return existing;
                })
                .orElseGet(() -> contactRepository.saveAndFlush(Contact.builder()
                        .tenantId(tenantId)
                        .phone(phone)
                        .name(name)
                        .build()));
    }

    /**
     * Records an inbound message on the contact's conversation.
     *
     * Existing conversation: lastMessageAt = max(lastMessageAt, at), unread + 1,
     * CLOSED reopens. These run as one atomic UPDATE and the row is read back
     * afterwards. New conversation: OPEN with unread = 1.
     */
    @Transactional
    public ConversationUpsert recordInbound(UUID tenantId, String phone, String contactName, Instant at) {
        Optional<Conversation> existing = conversationRepository.findByTenantIdAndContactPhone(tenantId, phone);
        if (existing.isPresent()) {
            UUID id = existing.get().getId();
            conversationRepository.recordInbound(id, at, hasText(contactName) ? contactName : null,
                    ConversationStatus.CLOSED, ConversationStatus.OPEN);
            Conversation updated = conversationRepository.findById(id)
                    .orElseThrow(() -> new MissingRecordException("Conversation", id));
            return new ConversationUpsert(updated, false);
        }

        Conversation created = conversationRepository.saveAndFlush(Conversation.builder()
                .tenantId(tenantId)
                .contactPhone(phone)
                .contactName(contactName)
                .status(ConversationStatus.OPEN)
                .lastMessageAt(at)
                .unreadCount(1)
                .build());
        log.info("Opened conversation {} for tenant {}", created.getId(), tenantId);
        return new ConversationUpsert(created, true);
    }

    /** Conversation an outbound message belongs to; opened without unread messages if new. */
    @Transactional
    public Conversation findOrOpen(UUID tenantId, String phone) {
        return conversationRepository.findByTenantIdAndContactPhone(tenantId, phone)
                .orElseGet(() -> conversationRepository.saveAndFlush(Conversation.builder()
                        .tenantId(tenantId)
                        .contactPhone(phone)
                        .status(ConversationStatus.OPEN)
                        .lastMessageAt(Instant.now())
                        .build()));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    @Getter
    @AllArgsConstructor
    public static class ConversationUpsert {
        private final Conversation conversation;
        private final boolean created;
    }
}
