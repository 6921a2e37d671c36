package com.inboxflow.service;

import com.inboxflow.model.ProviderCredential;
import com.inboxflow.repository.ProviderCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Maps a webhook routing key to the tenant that owns it.
 *
 * Message and status changes are routed by phone number id; account-level
 * changes (template reviews) only carry the business account id, so that is
 * tried second. Invalidated credentials still resolve: an expired token must
 * not make inbound traffic disappear.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TenantDirectory {

    private final ProviderCredentialRepository credentialRepository;

    public Optional<UUID> resolveTenantId(String routingKey) {
        if (routingKey == null || routingKey.isBlank()) {
            return Optional.empty();
        }

        Optional<ProviderCredential> credential = credentialRepository.findByPhoneNumberId(routingKey)
                .or(() -> credentialRepository.findByBusinessAccountId(routingKey));

        credential.filter(c -> !c.isValid())
                .ifPresent(c -> log.warn("Routing key {} belongs to an invalidated credential (tenant {})",
                        routingKey, c.getTenantId()));

        return credential.map(ProviderCredential::getTenantId);
    }
}
