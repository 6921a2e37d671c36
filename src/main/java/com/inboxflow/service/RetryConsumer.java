package com.inboxflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.JobEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Consumes scheduled retries and puts them back on their job topic.
 *
 * FLOW:
 *   inboxflow.retry → RetryConsumer reads the envelope
 *                          ↓
 *                  Wait until notBefore
 *                          ↓
 *                  Re-enqueue on the job's topic (attempt count kept)
 *
 * Uses its own consumer group "inboxflow-retry" so waiting retries never
 * hold up first attempts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetryConsumer {

    private final JobQueueService jobQueueService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @KafkaListener(topics = "${inboxflow.topics.retry:inboxflow.retry}", groupId = "inboxflow-retry")
    public void onRetry(String message) {
        JobEnvelope job;
        try {
            job = objectMapper.readValue(message, JobEnvelope.class);
        } catch (Exception e) {
            log.error("Unparseable retry envelope: {}", e.getMessage());
            deadLetterQueueService.sendRawToPermanentDlq(message, "Unparseable retry envelope: " + e.getMessage());
            return;
        }

        if (job.getJobType() == null || job.getTargetId() == null) {
            deadLetterQueueService.sendToPermanentDlq(job, "Retry envelope without job type or target");
            return;
        }

        try {
            long waitMs = job.getNotBefore() - clock.millis();
            if (waitMs > 0) {
                log.info("Waiting {}ms before retrying {} job {} (attempt {})",
                        waitMs, job.getJobType(), job.getTargetId(), job.getAttempt() + 1);
                Thread.sleep(waitMs);
            }

            jobQueueService.requeue(job);
            log.info("Re-enqueued {} job {} for attempt {}", job.getJobType(), job.getTargetId(), job.getAttempt() + 1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Retry of {} job {} interrupted: {}", job.getJobType(), job.getTargetId(), e.getMessage());
        }
    }
}
