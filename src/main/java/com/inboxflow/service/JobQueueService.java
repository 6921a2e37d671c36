package com.inboxflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.JobEnvelope;
import com.inboxflow.dto.JobType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Puts work on the Kafka job topics, at most once per target while it is queued.
 *
 * HOW IT WORKS:
 *   1. SET NX "inboxflow:queued:{type}:{targetId}" with a TTL
 *      (NX = only set if the key does NOT exist)
 *   2. Marker set    → publish the envelope to the job's topic
 *      Marker exists → a job for this target is already waiting, skip
 *   3. The consuming listener clears the marker before it processes,
 *      so a later enqueue (e.g. a retry) goes through again.
 *
 * Webhook jobs are keyed by raw event id. Send jobs are keyed by conversation
 * id, so one conversation's messages stay in one partition, in order.
 *
 * If Redis is down the marker is skipped and the job is published anyway:
 * the row-level claim in the consumer still stops double processing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobQueueService {

    static final String QUEUED_PREFIX = "inboxflow:queued:";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final InboxflowProperties properties;

    public boolean enqueueWebhookEvent(UUID rawEventId, UUID tenantId) {
        JobEnvelope job = JobEnvelope.builder()
                .jobType(JobType.WEBHOOK_EVENT)
                .targetId(rawEventId.toString())
                .tenantId(tenantId == null ? null : tenantId.toString())
                .partitionKey(rawEventId.toString())
                .build();
        return enqueue(job);
    }

    public boolean enqueueMessageSend(UUID messageId, UUID tenantId, UUID conversationId) {
        JobEnvelope job = JobEnvelope.builder()
                .jobType(JobType.MESSAGE_SEND)
                .targetId(messageId.toString())
                .tenantId(tenantId.toString())
                .partitionKey(conversationId.toString())
                .build();
        return enqueue(job);
    }

    /** Re-publishes a job coming back from the retry topic, keeping its attempt count. */
    public boolean requeue(JobEnvelope job) {
        return enqueue(job);
    }

    public void clearQueued(JobType type, String targetId) {
        try {
            redisTemplate.delete(markerKey(type, targetId));
        } catch (DataAccessException e) {
            log.warn("Could not clear queued marker for {} {}: {}", type, targetId, e.getMessage());
        }
    }

    public String topicFor(JobType type) {
        return switch (type) {
            case WEBHOOK_EVENT -> properties.getTopics().getWebhookEvents();
            case MESSAGE_SEND -> properties.getTopics().getMessageSend();
        };
    }

    private boolean enqueue(JobEnvelope job) {
        if (!markQueued(job.getJobType(), job.getTargetId())) {
            log.info("{} job for {} is already queued, skipping", job.getJobType(), job.getTargetId());
            return false;
        }

        String payload;
        try {
            payload = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            clearQueued(job.getJobType(), job.getTargetId());
            throw new IllegalStateException("Cannot serialize job envelope", e);
        }

        String topic = topicFor(job.getJobType());
        kafkaTemplate.send(topic, job.getPartitionKey(), payload).whenComplete((result, error) -> {
            if (error != null) {
                log.error("Failed to publish {} job for {} to {}: {}",
                        job.getJobType(), job.getTargetId(), topic, error.getMessage());
                clearQueued(job.getJobType(), job.getTargetId());
            }
        });
        log.debug("Enqueued {} job for {} (attempt {})", job.getJobType(), job.getTargetId(), job.getAttempt());
        return true;
    }

    private boolean markQueued(JobType type, String targetId) {
        try {
            Boolean wasSet = redisTemplate.opsForValue().setIfAbsent(markerKey(type, targetId), "1",
                    Duration.ofHours(properties.getWebhook().getQueuedMarkerTtlHours()));
            return Boolean.TRUE.equals(wasSet);
        } catch (DataAccessException e) {
            log.warn("Queued marker unavailable, publishing {} {} without it: {}", type, targetId, e.getMessage());
            return true;
        }
    }

    private static String markerKey(JobType type, String targetId) {
        return QUEUED_PREFIX + (type == JobType.WEBHOOK_EVENT ? "webhook:" : "send:") + targetId;
    }
}
