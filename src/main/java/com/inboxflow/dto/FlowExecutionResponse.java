package com.inboxflow.dto;

import com.inboxflow.model.FlowExecutionStatus;
import com.inboxflow.model.FlowTriggerType;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowExecutionResponse {
    private UUID id;
    private FlowExecutionStatus status;
    private FlowTriggerType triggeredBy;
    private String contactPhone;
    private String currentNodeId;
    private int retryCount;
    private String error;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
