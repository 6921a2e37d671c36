package com.inboxflow.dto;

import lombok.*;

/**
 * Message carried on the job, retry and dead-letter topics.
 *
 * Example JSON:
 * {
 *   "jobType": "MESSAGE_SEND",
 *   "targetId": "6f1c...",      (Message id, or RawEvent id for WEBHOOK_EVENT)
 *   "tenantId": "0b2e...",
 *   "partitionKey": "91ad...",  (Kafka key: conversation id for sends, raw event id otherwise)
 *   "attempt": 2,               (attempts already made)
 *   "error": "Rate limit exceeded ...",
 *   "notBefore": 1732101010000  (epoch millis; earliest time of the next attempt)
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class JobEnvelope {

    private JobType jobType;
    private String targetId;
    private String tenantId;
    private String partitionKey;
    private int attempt;
    private String error;
    private long notBefore;
}
