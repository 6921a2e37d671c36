package com.inboxflow.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.JobEnvelope;
import com.inboxflow.dto.JobType;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.RateLimitedException;
import com.inboxflow.exception.TransientInfraException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for DeadLetterQueueService.
 *
 * Verifies:
 *   - Backoff doubles from the 2s base: 2s, 4s, 8s, 16s
 *   - A job with max-attempts used up is parked, not retried
 *   - Non-retryable errors are parked on the first failure
 *   - A rate-limit retry-after longer than the backoff wins
 */
@ExtendWith(MockitoExtension.class)
class DeadLetterQueueServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock private KafkaTemplate<String, String> kafkaTemplate;
    @Spy  private ObjectMapper objectMapper = new ObjectMapper();

    private InboxflowProperties properties;
    private DeadLetterQueueService dlqService;

    @BeforeEach
    void setUp() {
        properties = new InboxflowProperties();
        dlqService = new DeadLetterQueueService(kafkaTemplate, objectMapper, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobEnvelope job(int attempt) {
        return JobEnvelope.builder()
                .jobType(JobType.MESSAGE_SEND)
                .targetId("msg-1")
                .tenantId("tenant-1")
                .partitionKey("conv-1")
                .attempt(attempt)
                .build();
    }

    private JobEnvelope capturedRetry() throws Exception {
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("inboxflow.retry"), eq("conv-1"), payload.capture());
        return objectMapper.readValue(payload.getValue(), JobEnvelope.class);
    }

    @Test
    @DisplayName("Backoff doubles per attempt from the base delay")
    void backoffSchedule() {
        assertEquals(2000, dlqService.calculateBackoff(1));
        assertEquals(4000, dlqService.calculateBackoff(2));
        assertEquals(8000, dlqService.calculateBackoff(3));
        assertEquals(16000, dlqService.calculateBackoff(4));
    }

    @Test
    @DisplayName("A transient failure is scheduled on the retry topic with notBefore = now + backoff")
    void schedulesRetry() throws Exception {
        boolean scheduled = dlqService.handleFailure(job(2), new TransientInfraException("redis timeout", null));

        assertTrue(scheduled);
        JobEnvelope retry = capturedRetry();
        assertEquals(2, retry.getAttempt());
        assertEquals("redis timeout", retry.getError());
        assertEquals(NOW.toEpochMilli() + 4000, retry.getNotBefore());
        assertEquals("conv-1", retry.getPartitionKey());
    }

    @Test
    @DisplayName("After max attempts the job is parked on the dead-letter topic")
    void exhaustedIsParked() throws Exception {
        boolean scheduled = dlqService.handleFailure(job(5), new RuntimeException("still down"));

        assertFalse(scheduled);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("inboxflow.dead-letter"), eq("conv-1"), payload.capture());
        verify(kafkaTemplate, never()).send(eq("inboxflow.retry"), anyString(), anyString());
        JsonNode parked = objectMapper.readTree(payload.getValue());
        assertTrue(parked.path("reason").asText().startsWith("Max retries exceeded: 5"));
        assertEquals("msg-1", parked.path("job").path("targetId").asText());
    }

    @Test
    @DisplayName("Non-retryable errors are parked on the first failure")
    void nonRetryableIsParked() {
        boolean scheduled = dlqService.handleFailure(job(1), new MissingRecordException("Message", "msg-1"));

        assertFalse(scheduled);
        verify(kafkaTemplate).send(eq("inboxflow.dead-letter"), eq("conv-1"), anyString());
    }

    @Test
    @DisplayName("A rate-limit retry-after longer than the backoff sets the delay")
    void rateLimitDelayWins() throws Exception {
        dlqService.handleFailure(job(1), new RateLimitedException("tenant-1", 30));

        assertEquals(NOW.toEpochMilli() + 30_000, capturedRetry().getNotBefore());
    }

    @Test
    @DisplayName("Attempts below max-attempts are retryable")
    void retryableThreshold() {
        assertTrue(dlqService.isRetryable(4));
        assertFalse(dlqService.isRetryable(5));
    }
}
