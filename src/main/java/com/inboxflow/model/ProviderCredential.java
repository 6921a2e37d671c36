package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Provider account credential for one tenant phone number.
 *
 * phoneNumberId doubles as the webhook routing key, so it is how an inbound
 * change finds its tenant. The access token is stored encrypted and only
 * decrypted right before a send call.
 */
@Entity
@Table(name = "provider_credentials")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProviderCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(name = "phone_number_id", nullable = false, unique = true)
    private String phoneNumberId;

    @Column(name = "business_account_id", unique = true)
    private String businessAccountId;

    @Column(name = "access_token", columnDefinition = "TEXT", nullable = false)
    private String accessToken;

    @Column(nullable = false)
    @Builder.Default
    private boolean valid = true;

    @Column(name = "invalid_reason", columnDefinition = "TEXT")
    private String invalidReason;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
