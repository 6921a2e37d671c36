package com.inboxflow.repository;

import com.inboxflow.model.Conversation;
import com.inboxflow.model.ConversationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

    Optional<Conversation> findByTenantIdAndContactPhone(UUID tenantId, String contactPhone);

    /**
     * Applies one inbound message in a single UPDATE, so concurrent workers for the
     * same contact never overwrite each other's unread increment or move
     * lastMessageAt backwards. A null contactName keeps the stored one.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           UPDATE Conversation c
              SET c.unreadCount = c.unreadCount + 1,
                  c.lastMessageAt = CASE WHEN c.lastMessageAt IS NULL OR c.lastMessageAt < :at
                                         THEN :at ELSE c.lastMessageAt END,
                  c.status = CASE WHEN c.status = :closed THEN :open ELSE c.status END,
                  c.contactName = COALESCE(:contactName, c.contactName)
            WHERE c.id = :id
           """)
    int recordInbound(@Param("id") UUID id,
                      @Param("at") Instant at,
                      @Param("contactName") String contactName,
                      @Param("closed") ConversationStatus closed,
                      @Param("open") ConversationStatus open);
}
