package com.inboxflow.service.flow;

import com.inboxflow.dto.FlowExecutionResponse;
import com.inboxflow.dto.FlowExecutionStatsResponse;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.ProcessingException;
import com.inboxflow.model.FlowExecution;
import com.inboxflow.model.FlowExecutionStatus;
import com.inboxflow.repository.FlowExecutionRepository;
import com.inboxflow.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * State transitions of the flow execution outbox.
 *
 *   PENDING ──claim──→ PROCESSING ──→ COMPLETED
 *      ↑                   │
 *      └── retry left ─────┴──→ FAILED (definition error, or retries used up)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowExecutionService {

    private final FlowExecutionRepository flowExecutionRepository;
    private final FlowRepository flowRepository;
    private final Clock clock;

    /** Reads due candidates and keeps only the ones this instance won. */
    public List<UUID> claimDue(int limit) {
        Instant now = clock.instant();
        return flowExecutionRepository.findDueIds(FlowExecutionStatus.PENDING, now, PageRequest.of(0, limit))
                .stream()
                .filter(id -> flowExecutionRepository.claim(id, now,
                        FlowExecutionStatus.PROCESSING, FlowExecutionStatus.PENDING) == 1)
                .collect(Collectors.toList());
    }

    public FlowExecution load(UUID executionId) {
        return flowExecutionRepository.findById(executionId)
                .orElseThrow(() -> new MissingRecordException("Flow execution", executionId));
    }

    /** Hands a claimed row back, e.g. when the worker pool refused it. */
    @Transactional
    public void release(UUID executionId) {
        flowExecutionRepository.findById(executionId).ifPresent(execution -> {
            if (execution.getStatus() == FlowExecutionStatus.PROCESSING) {
                execution.setStatus(FlowExecutionStatus.PENDING);
                flowExecutionRepository.save(execution);
            }
        });
    }

    public int releaseStale(long staleAfterMs) {
        Instant cutoff = clock.instant().minusMillis(staleAfterMs);
        int released = flowExecutionRepository.releaseStale(cutoff,
                FlowExecutionStatus.PROCESSING, FlowExecutionStatus.PENDING);
        if (released > 0) {
            log.warn("Released {} flow executions stuck in PROCESSING since before {}", released, cutoff);
        }
        return released;
    }

    @Transactional
    public void complete(UUID executionId) {
        FlowExecution execution = load(executionId);
        execution.setStatus(FlowExecutionStatus.COMPLETED);
        execution.setCompletedAt(clock.instant());
        execution.setError(null);
        flowExecutionRepository.save(execution);

        // Delay continuations are part of the run that created them
        if (execution.getParentExecutionId() == null) {
            flowRepository.incrementRunsCount(execution.getFlowId());
        }
        log.info("Flow execution {} completed (flow {})", executionId, execution.getFlowId());
    }

    /**
     * Definition errors fail at once. Anything else goes back to PENDING while
     * retryCount stays below maxRetries.
     */
    @Transactional
    public void fail(UUID executionId, Throwable error) {
        FlowExecution execution = load(executionId);
        int retryCount = execution.getRetryCount() + 1;
        boolean retry = ProcessingException.isRetryable(error) && retryCount < execution.getMaxRetries();

        execution.setRetryCount(retryCount);
        execution.setError(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        if (retry) {
            execution.setStatus(FlowExecutionStatus.PENDING);
            log.warn("Flow execution {} failed (attempt {}/{}), will retry: {}",
                    executionId, retryCount, execution.getMaxRetries(), execution.getError());
        } else {
            execution.setStatus(FlowExecutionStatus.FAILED);
            execution.setCompletedAt(clock.instant());
            log.error("Flow execution {} failed permanently after {} attempt(s): {}",
                    executionId, retryCount, execution.getError());
        }
        flowExecutionRepository.save(execution);
    }

    /** Persists the rest of a path that waits on a Delay node. */
    @Transactional
    public FlowExecution scheduleContinuation(FlowExecution parent, String delayNodeId,
                                              Map<String, Object> state, Instant wakeAt) {
        FlowExecution continuation = flowExecutionRepository.save(FlowExecution.builder()
                .flowId(parent.getFlowId())
                .tenantId(parent.getTenantId())
                .contactPhone(parent.getContactPhone())
                .conversationId(parent.getConversationId())
                .messageBody(parent.getMessageBody())
                .messageType(parent.getMessageType())
                .triggeredBy(parent.getTriggeredBy())
                .triggerData(new LinkedHashMap<>(parent.getTriggerData()))
                .currentNodeId(delayNodeId)
                .executionState(new LinkedHashMap<>(state))
                .maxRetries(parent.getMaxRetries())
                .wakeAt(wakeAt)
                .parentExecutionId(parent.getId())
                .build());
        log.info("Flow execution {} waits at node {} until {}: continuation={}",
                parent.getId(), delayNodeId, wakeAt, continuation.getId());
        return continuation;
    }

    @Transactional(readOnly = true)
    public List<FlowExecutionResponse> recent(UUID flowId, int limit) {
        return flowExecutionRepository.findByFlowIdOrderByCreatedAtDesc(flowId, PageRequest.of(0, limit))
                .stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public FlowExecutionStatsResponse stats(UUID flowId) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (FlowExecutionStatus status : FlowExecutionStatus.values()) {
            byStatus.put(status.name(), 0L);
        }
        long total = 0;
        for (Object[] row : flowExecutionRepository.countByStatus(flowId)) {
            long count = ((Number) row[1]).longValue();
            byStatus.put(((FlowExecutionStatus) row[0]).name(), count);
            total += count;
        }
        return FlowExecutionStatsResponse.builder()
                .total(total)
                .byStatus(byStatus)
                .build();
    }

    private FlowExecutionResponse toResponse(FlowExecution e) {
        return FlowExecutionResponse.builder()
                .id(e.getId())
                .status(e.getStatus())
                .triggeredBy(e.getTriggeredBy())
                .contactPhone(e.getContactPhone())
                .currentNodeId(e.getCurrentNodeId())
                .retryCount(e.getRetryCount())
                .error(e.getError())
                .createdAt(e.getCreatedAt())
                .startedAt(e.getStartedAt())
                .completedAt(e.getCompletedAt())
                .build();
    }
}
