package com.inboxflow.service.flow;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.model.FlowExecution;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Drains the flow execution outbox.
 *
 * FLOW (every poll-interval-ms):
 *   findDueIds(PENDING, wakeAt ≤ now)  → up to batch-size ids, oldest first
 *        ↓
 *   claim each: UPDATE … SET PROCESSING WHERE id = ? AND status = PENDING
 *        ↓ (only claims this instance won)
 *   flowExecutor pool → engine.execute → COMPLETED, or fail() → PENDING / FAILED
 *
 * Rows left in PROCESSING by a crashed worker are put back once they are older
 * than stale-after-ms.
 */
@Component
@Slf4j
public class FlowExecutionPoller {

    private final FlowExecutionService flowExecutionService;
    private final FlowExecutionEngine engine;
    private final ThreadPoolTaskExecutor flowExecutor;
    private final InboxflowProperties properties;

    public FlowExecutionPoller(FlowExecutionService flowExecutionService,
                               FlowExecutionEngine engine,
                               @Qualifier("flowExecutor") ThreadPoolTaskExecutor flowExecutor,
                               InboxflowProperties properties) {
        this.flowExecutionService = flowExecutionService;
        this.engine = engine;
        this.flowExecutor = flowExecutor;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${inboxflow.flows.poll-interval-ms:1000}")
    public void poll() {
        if (!properties.getFlows().isPollerEnabled()) {
            return;
        }
        List<UUID> claimed;
        try {
            claimed = flowExecutionService.claimDue(properties.getFlows().getBatchSize());
        } catch (Exception e) {
            log.error("Flow execution pickup failed: {}", e.getMessage(), e);
            return;
        }

        for (UUID executionId : claimed) {
            try {
                flowExecutor.execute(() -> run(executionId));
            } catch (TaskRejectedException e) {
                log.warn("Flow worker pool full, handing execution {} back", executionId);
                flowExecutionService.release(executionId);
            }
        }
    }

    @Scheduled(fixedDelayString = "${inboxflow.flows.stale-check-interval-ms:60000}")
    public void releaseStale() {
        if (!properties.getFlows().isPollerEnabled()) {
            return;
        }
        try {
            flowExecutionService.releaseStale(properties.getFlows().getStaleAfterMs());
        } catch (Exception e) {
            log.error("Releasing stale flow executions failed: {}", e.getMessage(), e);
        }
    }

    void run(UUID executionId) {
        MDC.put("flowExecutionId", executionId.toString());
        try {
            FlowExecution execution = flowExecutionService.load(executionId);
            engine.execute(execution);
            flowExecutionService.complete(executionId);
        } catch (Exception e) {
            log.error("Flow execution {} failed: {}", executionId, e.getMessage(), e);
            try {
                flowExecutionService.fail(executionId, e);
            } catch (Exception recordError) {
                // Row stays PROCESSING; the stale sweep hands it back later
                log.error("Could not record failure of flow execution {}: {}",
                        executionId, recordError.getMessage(), recordError);
            }
        } finally {
            MDC.remove("flowExecutionId");
        }
    }
}
