package com.inboxflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.JobEnvelope;
import com.inboxflow.exception.ProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Decides what happens to a job that failed.
 *
 *   error not retryable          → permanent dead-letter topic
 *   attempts made < max-attempts → retry topic, with notBefore = now + backoff
 *   attempts exhausted           → permanent dead-letter topic
 *
 * BACKOFF (defaults, configurable via application.yml):
 *   after attempt 1 → 2s, 2 → 4s, 3 → 8s, 4 → 16s, 5 → parked
 * A RateLimitedException stretches the wait to its retry-after when that is longer.
 *
 * Jobs on the permanent topic are NOT retried automatically; they wait for
 * manual inspection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final InboxflowProperties properties;
    private final Clock clock;

    /**
     * @param job   the failed job; {@code attempt} is the number of attempts made so far
     * @return true if a retry was scheduled, false if the job was parked
     */
    public boolean handleFailure(JobEnvelope job, Throwable error) {
        String message = describe(error);

        if (!ProcessingException.isRetryable(error)) {
            sendToPermanentDlq(job, "Non-retryable: " + message);
            return false;
        }

        if (!isRetryable(job.getAttempt())) {
            log.error("CRITICAL: {} job {} exhausted all retries (attempts={})",
                    job.getJobType(), job.getTargetId(), job.getAttempt());
            sendToPermanentDlq(job, "Max retries exceeded: " + job.getAttempt() + " (" + message + ")");
            return false;
        }

        long delayMs = calculateBackoff(job.getAttempt());
        if (error instanceof ProcessingException) {
            delayMs = Math.max(delayMs, ((ProcessingException) error).getRetryAfterMillis());
        }

        JobEnvelope retry = job.toBuilder()
                .error(message)
                .notBefore(clock.millis() + delayMs)
                .build();
        try {
            kafkaTemplate.send(properties.getTopics().getRetry(), job.getPartitionKey(),
                    objectMapper.writeValueAsString(retry));
            log.info("Scheduled retry for {} job {}: attempt={}, backoff={}ms, error={}",
                    job.getJobType(), job.getTargetId(), job.getAttempt() + 1, delayMs, message);
            return true;
        } catch (Exception e) {
            log.error("CRITICAL: Failed to schedule retry for {} job {}: {}",
                    job.getJobType(), job.getTargetId(), e.getMessage(), e);
            return false;
        }
    }

    /** Parks a job for manual investigation. It will NOT be retried automatically. */
    public void sendToPermanentDlq(JobEnvelope job, String reason) {
        try {
            Map<String, Object> deadLetter = new HashMap<>();
            deadLetter.put("job", job);
            deadLetter.put("reason", reason);
            deadLetter.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDeadLetter(), job.getPartitionKey(),
                    objectMapper.writeValueAsString(deadLetter));
            log.error("CRITICAL: {} job {} moved to permanent DLQ: reason={}",
                    job.getJobType(), job.getTargetId(), reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send {} job {} to permanent DLQ: {}",
                    job.getJobType(), job.getTargetId(), e.getMessage(), e);
        }
    }

    /** Parks a topic message that could not even be parsed into a job. */
    public void sendRawToPermanentDlq(String rawMessage, String reason) {
        try {
            Map<String, Object> deadLetter = new HashMap<>();
            deadLetter.put("rawMessage", rawMessage);
            deadLetter.put("reason", reason);
            deadLetter.put("timestamp", clock.millis());

            kafkaTemplate.send(properties.getTopics().getDeadLetter(), objectMapper.writeValueAsString(deadLetter));
            log.error("CRITICAL: Unparseable job moved to permanent DLQ: reason={}", reason);
        } catch (Exception e) {
            log.error("CRITICAL: Failed to send raw job to permanent DLQ: {}", e.getMessage(), e);
        }
    }

    public boolean isRetryable(int attemptsMade) {
        return attemptsMade < properties.getRetry().getMaxAttempts();
    }

    long calculateBackoff(int attemptsMade) {
        long baseDelay = properties.getRetry().getBaseDelayMs();
        int exponent = Math.max(0, attemptsMade - 1);
        return baseDelay * (1L << Math.min(exponent, 20));
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
