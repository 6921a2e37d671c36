package com.inboxflow.repository;

import com.inboxflow.model.Flow;
import com.inboxflow.model.FlowTriggerType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * findByTenantIdAndTriggerTypeAndActiveTrue(tenantId, KEYWORD)
 * → SELECT * FROM flows WHERE tenant_id = ? AND trigger_type = 'KEYWORD' AND active = true
 */
public interface FlowRepository extends JpaRepository<Flow, UUID> {

    // Used by the trigger matcher
    List<Flow> findByTenantIdAndTriggerTypeAndActiveTrue(UUID tenantId, FlowTriggerType triggerType);

    // Used by the API: everything is tenant-scoped
    List<Flow> findByTenantIdOrderByCreatedAtDesc(UUID tenantId);

    Optional<Flow> findByIdAndTenantId(UUID id, UUID tenantId);

    @Transactional
    @Modifying
    @Query("UPDATE Flow f SET f.runsCount = f.runsCount + 1 WHERE f.id = :id")
    int incrementRunsCount(@Param("id") UUID id);
}
