package com.inboxflow.service;

import com.inboxflow.dto.RealtimeEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed {@link RealtimeEvent}s to the Redis channel the socket
 * gateway subscribes to.
 *
 * FLOW:
 *   handler publishes event inside its transaction
 *        ↓ (held by Spring until commit; dropped on rollback)
 *   onRealtimeEvent → JSON → PUBLISH inboxflow:realtime-events
 *
 * Outside a transaction the event is relayed immediately (fallbackExecution).
 * A failed publish is logged and dropped: UI notifications are best effort.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventRelay {

    public static final String CHANNEL = "inboxflow:realtime-events";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRealtimeEvent(RealtimeEvent event) {
        try {
            redisTemplate.convertAndSend(CHANNEL, objectMapper.writeValueAsString(event));
            log.debug("Published {} for tenant {}", event.getType().getWireName(), event.getTenantId());
        } catch (Exception e) {
            log.error("Failed to publish realtime event {} for tenant {}: {}",
                    event.getType(), event.getTenantId(), e.getMessage());
        }
    }
}
