package com.inboxflow.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxflow.model.FlowTriggerType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * Flow as saved by the flow builder. nodes/edges are passed through as JSON and
 * validated into a typed graph before anything is stored.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowRequest {

    @NotBlank(message = "name is required")
    private String name;

    private String description;

    @NotNull(message = "triggerType is required")
    private FlowTriggerType triggerType;

    // Comma-separated; required for KEYWORD flows
    private String triggerKeywords;

    @NotNull(message = "nodes are required")
    private JsonNode nodes;

    @NotNull(message = "edges are required")
    private JsonNode edges;

    @Builder.Default
    private Boolean active = Boolean.TRUE;
}
