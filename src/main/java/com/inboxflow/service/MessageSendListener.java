package com.inboxflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.JobEnvelope;
import com.inboxflow.dto.JobType;
import com.inboxflow.exception.ProcessingException;
import com.inboxflow.exception.RateLimitedException;
import com.inboxflow.service.dispatch.MessageDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for outbound sends on "inboxflow.message-send".
 *
 * Jobs are keyed by conversation id, so sends within one conversation are
 * consumed in order. A retryable failure goes to the retry topic; a send that
 * only waits for tenant quota keeps its attempt count. When the
 * retries are used up, the message is marked FAILED here: the dispatcher left it
 * PENDING in case another attempt would succeed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageSendListener {

    private final MessageDispatcher dispatcher;
    private final JobQueueService jobQueueService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${inboxflow.topics.message-send:inboxflow.message-send}",
            groupId = "inboxflow-message-sender",
            concurrency = "${inboxflow.dispatch.concurrency:5}")
    public void onMessageSend(String message) {
        JobEnvelope job;
        UUID messageId;
        try {
            job = objectMapper.readValue(message, JobEnvelope.class);
            messageId = UUID.fromString(job.getTargetId());
        } catch (Exception e) {
            log.error("Unparseable send job: {}", e.getMessage());
            deadLetterQueueService.sendRawToPermanentDlq(message, "Unparseable send job: " + e.getMessage());
            return;
        }

        MDC.put("messageId", messageId.toString());
        try {
            jobQueueService.clearQueued(JobType.MESSAGE_SEND, job.getTargetId());
            dispatcher.dispatch(messageId);
        } catch (Exception e) {
            // Waiting for quota is not a failed attempt
            int attempts = e instanceof RateLimitedException ? job.getAttempt() : job.getAttempt() + 1;
            JobEnvelope failed = job.toBuilder()
                    .attempt(attempts)
                    .build();
            boolean retrying = deadLetterQueueService.handleFailure(failed, e);
            if (!retrying && ProcessingException.isRetryable(e)) {
                dispatcher.markAbandoned(messageId, "Gave up after " + failed.getAttempt() + " attempts: "
                        + e.getMessage());
            }
        } finally {
            MDC.remove("messageId");
        }
    }
}
