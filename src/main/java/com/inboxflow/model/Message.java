package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A single inbound or outbound message.
 *
 * externalMessageId is the provider-assigned id (wamid.*) and the sole idempotency
 * key: inbound messages carry it from the webhook, outbound messages receive it
 * when the send call succeeds. Delivery receipts are correlated through it.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_conversation", columnList = "conversation_id, created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "conversation_id", nullable = false)
    private UUID conversationId;

    @Column(name = "external_message_id", unique = true)
    private String externalMessageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageDirection direction;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private MessageStatus status = MessageStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private MessageType type = MessageType.TEXT;

    @Column(name = "from_number")
    private String from;

    @Column(name = "to_number")
    private String to;

    @Column(columnDefinition = "TEXT")
    private String text;

    @Column(name = "media_id")
    private String mediaId;

    @Column(name = "media_url", columnDefinition = "TEXT")
    private String mediaUrl;

    @Column(name = "media_mime_type")
    private String mediaMimeType;

    @Column(name = "media_caption", columnDefinition = "TEXT")
    private String mediaCaption;

    @Column(name = "media_filename")
    private String mediaFilename;

    @Column(name = "template_name")
    private String templateName;

    @Column(name = "template_language")
    private String templateLanguage;

    /** JSON array of body parameter strings. */
    @Column(name = "template_params", columnDefinition = "TEXT")
    private String templateParams;

    /** JSON of the provider "interactive" object (buttons, lists, or the reply received). */
    @Column(name = "interactive_data", columnDefinition = "TEXT")
    private String interactiveData;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    private Instant timestamp;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
