package com.inboxflow.repository;

import com.inboxflow.model.MessageTemplate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MessageTemplateRepository extends JpaRepository<MessageTemplate, UUID> {

    Optional<MessageTemplate> findByTenantIdAndExternalId(UUID tenantId, String externalId);

    // Fallback when the template was created before its provider id was known
    Optional<MessageTemplate> findByTenantIdAndNameAndLanguage(UUID tenantId, String name, String language);
}
