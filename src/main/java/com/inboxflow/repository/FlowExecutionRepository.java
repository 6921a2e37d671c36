package com.inboxflow.repository;

import com.inboxflow.model.FlowExecution;
import com.inboxflow.model.FlowExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outbox table for flow runs. Pickup is two steps: read a page of due candidates,
 * then claim each one with a conditional UPDATE. Only the instance whose UPDATE
 * returns 1 executes the row, so any number of pollers can run side by side.
 */
public interface FlowExecutionRepository extends JpaRepository<FlowExecution, UUID> {

    @Query("""
           SELECT e.id
             FROM FlowExecution e
            WHERE e.status = :status
              AND (e.wakeAt IS NULL OR e.wakeAt <= :now)
         ORDER BY e.createdAt ASC, e.id ASC
           """)
    List<UUID> findDueIds(@Param("status") FlowExecutionStatus status,
                          @Param("now") Instant now,
                          Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE FlowExecution e
              SET e.status = :processing, e.startedAt = :now
            WHERE e.id = :id
              AND e.status = :pending
           """)
    int claim(@Param("id") UUID id,
              @Param("now") Instant now,
              @Param("processing") FlowExecutionStatus processing,
              @Param("pending") FlowExecutionStatus pending);

    /** Returns rows stuck in PROCESSING (worker died mid-run) to the queue. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE FlowExecution e
              SET e.status = :pending
            WHERE e.status = :processing
              AND e.startedAt < :startedBefore
           """)
    int releaseStale(@Param("startedBefore") Instant startedBefore,
                     @Param("processing") FlowExecutionStatus processing,
                     @Param("pending") FlowExecutionStatus pending);

    List<FlowExecution> findByFlowIdOrderByCreatedAtDesc(UUID flowId, Pageable pageable);

    @Query("""
           SELECT e.status, COUNT(e)
             FROM FlowExecution e
            WHERE e.flowId = :flowId
         GROUP BY e.status
           """)
    List<Object[]> countByStatus(@Param("flowId") UUID flowId);
}
