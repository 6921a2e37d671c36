package com.inboxflow.service;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.model.RawEvent;
import com.inboxflow.model.RawEventStatus;
import com.inboxflow.repository.RawEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Re-enqueues raw events that were persisted but never reached a worker,
 * e.g. because the broker was down when the webhook arrived. Rows a dead worker
 * left in PROCESSING are first released back to PENDING, so the same sweep
 * picks them up.
 *
 * Safe to run on every instance: the queued marker drops duplicate jobs and
 * the processor's claim drops duplicate processing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RawEventRecoveryJob {

    private final RawEventRepository rawEventRepository;
    private final JobQueueService jobQueueService;
    private final InboxflowProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${inboxflow.processing.recovery-interval-ms:60000}",
            initialDelayString = "${inboxflow.processing.recovery-interval-ms:60000}")
    public void recoverStranded() {
        InboxflowProperties.Processing processing = properties.getProcessing();
        try {
            int released = rawEventRepository.releaseStale(
                    clock.instant().minusMillis(processing.getStaleAfterMs()),
                    RawEventStatus.PROCESSING, RawEventStatus.PENDING);
            if (released > 0) {
                log.warn("Released {} raw events stuck in PROCESSING", released);
            }

            List<UUID> stranded = rawEventRepository.findIdsByStatusCreatedBefore(RawEventStatus.PENDING,
                    clock.instant().minusMillis(processing.getRecoverAfterMs()),
                    PageRequest.of(0, processing.getRecoveryBatchSize()));

            int requeued = 0;
            for (UUID id : stranded) {
                UUID tenantId = rawEventRepository.findById(id).map(RawEvent::getTenantId).orElse(null);
                if (jobQueueService.enqueueWebhookEvent(id, tenantId)) {
                    requeued++;
                }
            }
            if (requeued > 0) {
                log.warn("Re-enqueued {} stranded raw events", requeued);
            }
        } catch (Exception e) {
            log.error("Raw event recovery failed: {}", e.getMessage(), e);
        }
    }
}
