package com.inboxflow.dto;

import lombok.*;

import java.util.Map;
import java.util.UUID;

/**
 * State-change notification fanned out to connected UI clients.
 *
 * Example JSON on the Redis channel:
 * {"type":"message:new","tenantId":"0b2e...","data":{"conversationId":"...","messageId":"..."}}
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RealtimeEvent {

    private RealtimeEventType type;
    private UUID tenantId;
    private Map<String, Object> data;
}
