package com.inboxflow.repository;

import com.inboxflow.model.ProviderCredential;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ProviderCredentialRepository extends JpaRepository<ProviderCredential, UUID> {

    // Webhook routing: value.metadata.phone_number_id
    Optional<ProviderCredential> findByPhoneNumberId(String phoneNumberId);

    // Webhook routing for account-level changes (template status): entry.id
    Optional<ProviderCredential> findByBusinessAccountId(String businessAccountId);

    // Outbound sends use whichever valid credential the tenant has
    Optional<ProviderCredential> findFirstByTenantIdAndValidTrue(UUID tenantId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
           UPDATE ProviderCredential c
              SET c.valid = false, c.invalidReason = :reason, c.updatedAt = :now
            WHERE c.id = :id
           """)
    int invalidate(@Param("id") UUID id, @Param("reason") String reason, @Param("now") Instant now);
}
