package com.inboxflow.repository;

import com.inboxflow.model.RawEvent;
import com.inboxflow.model.RawEventStatus;
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
 * Raw webhook rows. Every state change is a single conditional UPDATE so two
 * workers handed the same job cannot both process it.
 */
public interface RawEventRepository extends JpaRepository<RawEvent, UUID> {

    /**
     * PENDING, or FAILED with retries left → PROCESSING.
     * Returns 1 if this caller won the claim, 0 otherwise.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE RawEvent r
              SET r.status = :processing, r.claimedAt = :now
            WHERE r.id = :id
              AND (r.status = :pending
                   OR (r.status = :failed AND r.retryCount < :maxAttempts))
           """)
    int claim(@Param("id") UUID id,
              @Param("maxAttempts") int maxAttempts,
              @Param("now") Instant now,
              @Param("processing") RawEventStatus processing,
              @Param("pending") RawEventStatus pending,
              @Param("failed") RawEventStatus failed);

    /**
     * Returns rows stuck in PROCESSING (worker died after its claim) to PENDING.
     * A row claimed before the column existed has no claimedAt and is released too.
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE RawEvent r
              SET r.status = :pending
            WHERE r.status = :processing
              AND (r.claimedAt IS NULL OR r.claimedAt < :claimedBefore)
           """)
    int releaseStale(@Param("claimedBefore") Instant claimedBefore,
                     @Param("processing") RawEventStatus processing,
                     @Param("pending") RawEventStatus pending);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RawEvent r SET r.tenantId = :tenantId WHERE r.id = :id")
    int assignTenant(@Param("id") UUID id, @Param("tenantId") UUID tenantId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE RawEvent r
              SET r.status = :status, r.processedAt = :processedAt, r.errorMessage = null
            WHERE r.id = :id
           """)
    int markProcessed(@Param("id") UUID id,
                      @Param("status") RawEventStatus status,
                      @Param("processedAt") Instant processedAt);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE RawEvent r
              SET r.status = :status, r.errorMessage = :error, r.retryCount = r.retryCount + 1
            WHERE r.id = :id
           """)
    int markFailed(@Param("id") UUID id,
                   @Param("status") RawEventStatus status,
                   @Param("error") String error);

    /** Rows that were persisted but never picked up, e.g. because the enqueue failed. */
    @Query("""
           SELECT r.id
             FROM RawEvent r
            WHERE r.status = :status
              AND r.createdAt < :createdBefore
         ORDER BY r.createdAt ASC
           """)
    List<UUID> findIdsByStatusCreatedBefore(@Param("status") RawEventStatus status,
                                            @Param("createdBefore") Instant createdBefore,
                                            Pageable pageable);
}
