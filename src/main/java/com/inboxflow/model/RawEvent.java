package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable copy of one webhook {@code change} object, written before any processing
 * happens so a crash between receipt and processing never loses provider data.
 *
 * Example:
 *   routingKey = "106540352242922"          (value.metadata.phone_number_id)
 *   tenantId   = null                        (resolved later if unknown at receipt)
 *   payload    = {"field":"messages","value":{...}}
 *   status     = PENDING
 */
@Entity
@Table(name = "raw_events", indexes = {
    @Index(name = "idx_raw_events_status", columnList = "status, created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RawEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id")
    private UUID tenantId;

    @Column(name = "routing_key", nullable = false)
    private String routingKey;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private RawEventStatus status = RawEventStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    /** Set on every claim; a PROCESSING row with an old claim belongs to a dead worker. */
    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
