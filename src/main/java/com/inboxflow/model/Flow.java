package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * A tenant-defined automation graph.
 *
 * nodes and edges are stored exactly as the flow builder saves them (JSON arrays)
 * and are turned into a typed, validated graph on load.
 *
 * Example:
 *   triggerType     = KEYWORD
 *   triggerKeywords = "help,support"
 *   nodes           = [{"id":"start","type":"start","data":{}},
 *                      {"id":"m1","type":"message","data":{"content":"Hi! How can we help?"}}]
 *   edges           = [{"id":"e1","source":"start","target":"m1"}]
 */
@Entity
@Table(name = "flows", indexes = {
    @Index(name = "idx_flows_tenant_trigger", columnList = "tenant_id, trigger_type, active")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Flow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private FlowTriggerType triggerType;

    @Column(name = "trigger_keywords", columnDefinition = "TEXT")
    private String triggerKeywords;

    @Column(columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private String nodes = "[]";

    @Column(columnDefinition = "TEXT", nullable = false)
    @Builder.Default
    private String edges = "[]";

    @Column(nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "runs_count", nullable = false)
    private long runsCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
