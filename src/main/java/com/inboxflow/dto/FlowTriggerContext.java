package com.inboxflow.dto;

import lombok.*;

import java.util.UUID;

/**
 * What the trigger matcher knows about the inbound event that may start flows.
 * Copied onto every FlowExecution it creates.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class FlowTriggerContext {

    private String contactPhone;
    private String messageBody;
    private String messageType;
    private UUID contactId;
    private UUID conversationId;
}
