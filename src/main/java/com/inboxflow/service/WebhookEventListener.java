package com.inboxflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.JobEnvelope;
import com.inboxflow.dto.JobType;
import com.inboxflow.service.inbound.WebhookEventProcessor;
import com.inboxflow.service.ratelimit.ProcessingThrottle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for webhook jobs on "inboxflow.webhook-events".
 *
 * FLOW:
 *   JobEnvelope{targetId = raw event id}
 *        ↓
 *   clear queued marker → global throttle → WebhookEventProcessor.process()
 *        ↓ (on failure)
 *   DeadLetterQueueService with the attempt count stored on the row
 *
 * The consumer group "inboxflow-webhook-processor" gives each job to exactly
 * one instance; concurrency is set by inboxflow.processing.concurrency.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookEventListener {

    private final WebhookEventProcessor processor;
    private final JobQueueService jobQueueService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ProcessingThrottle processingThrottle;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${inboxflow.topics.webhook-events:inboxflow.webhook-events}",
            groupId = "inboxflow-webhook-processor",
            concurrency = "${inboxflow.processing.concurrency:10}")
    public void onWebhookEvent(String message) {
        JobEnvelope job;
        UUID rawEventId;
        try {
            job = objectMapper.readValue(message, JobEnvelope.class);
            rawEventId = UUID.fromString(job.getTargetId());
        } catch (Exception e) {
            log.error("Unparseable webhook job: {}", e.getMessage());
            deadLetterQueueService.sendRawToPermanentDlq(message, "Unparseable webhook job: " + e.getMessage());
            return;
        }

        MDC.put("rawEventId", rawEventId.toString());
        try {
            jobQueueService.clearQueued(JobType.WEBHOOK_EVENT, job.getTargetId());
            processingThrottle.acquire();
            processor.process(rawEventId);
        } catch (Exception e) {
            JobEnvelope failed = job.toBuilder()
                    .attempt(processor.attemptsMade(rawEventId))
                    .build();
            deadLetterQueueService.handleFailure(failed, e);
        } finally {
            MDC.remove("rawEventId");
        }
    }
}
