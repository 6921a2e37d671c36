package com.inboxflow.repository;

import com.inboxflow.model.Message;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MessageRepository extends JpaRepository<Message, UUID> {

    // Idempotency check for inbound webhook messages
    boolean existsByExternalMessageId(String externalMessageId);

    // Delivery receipts correlate through the provider id
    Optional<Message> findByExternalMessageId(String externalMessageId);
}
