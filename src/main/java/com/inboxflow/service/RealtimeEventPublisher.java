package com.inboxflow.service;

import com.inboxflow.dto.RealtimeEvent;
import com.inboxflow.dto.RealtimeEventType;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for UI notifications. Events are handed to Spring's event bus
 * and only leave the process once the surrounding transaction commits
 * (see {@link RealtimeEventRelay}).
 */
@Component
@RequiredArgsConstructor
public class RealtimeEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    public void publish(RealtimeEventType type, UUID tenantId, Map<String, Object> data) {
        applicationEventPublisher.publishEvent(RealtimeEvent.builder()
                .type(type)
                .tenantId(tenantId)
                .data(data)
                .build());
    }
}
