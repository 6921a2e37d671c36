package com.inboxflow.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Tenant account as seen by the messaging core. Owned and written by the account
 * service; this module only reads the send quota.
 */
@Entity
@Table(name = "tenants")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Tenant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    // null = platform default
    @Column(name = "messages_per_minute")
    private Integer messagesPerMinute;

    private String status;
}
