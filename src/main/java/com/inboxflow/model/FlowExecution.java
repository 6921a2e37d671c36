package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outbox row for one run (or resumable partial run) of a Flow against a contact.
 *
 * Trigger matching only inserts these rows; the poller claims PENDING rows whose
 * wakeAt has passed and executes them. A non-null currentNodeId is a resume point:
 * traversal continues from that node instead of from the Start node.
 *
 * Continuations created by a Delay node carry parentExecutionId, so a flow's
 * run counter only moves for top-level triggers.
 */
@Entity
@Table(name = "flow_executions", indexes = {
    @Index(name = "idx_flow_executions_pickup", columnList = "status, created_at"),
    @Index(name = "idx_flow_executions_flow", columnList = "flow_id, created_at")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "contact_phone", nullable = false)
    private String contactPhone;

    @Column(name = "conversation_id")
    private UUID conversationId;

    @Column(name = "message_body", columnDefinition = "TEXT")
    private String messageBody;

    @Column(name = "message_type")
    private String messageType;

    @Enumerated(EnumType.STRING)
    @Column(name = "triggered_by", nullable = false)
    private FlowTriggerType triggeredBy;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "trigger_data", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> triggerData = new LinkedHashMap<>();

    @Column(name = "current_node_id")
    private String currentNodeId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "execution_state", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> executionState = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private FlowExecutionStatus status = FlowExecutionStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false)
    @Builder.Default
    private int maxRetries = 3;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "wake_at")
    private Instant wakeAt;

    @Column(name = "parent_execution_id")
    private UUID parentExecutionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
