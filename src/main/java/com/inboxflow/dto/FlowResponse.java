package com.inboxflow.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.model.FlowTriggerType;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowResponse {
    private UUID id;
    private String name;
    private String description;
    private FlowTriggerType triggerType;
    private String triggerKeywords;
    private JsonNode nodes;
    private JsonNode edges;
    private boolean active;
    private long runsCount;
    private Instant createdAt;
    private Instant updatedAt;
}
