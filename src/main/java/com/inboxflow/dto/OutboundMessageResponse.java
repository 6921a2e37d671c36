package com.inboxflow.dto;

import com.inboxflow.model.MessageStatus;
import lombok.*;

import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OutboundMessageResponse {
    private UUID id;
    private UUID conversationId;
    private MessageStatus status;
}
