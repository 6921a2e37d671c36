package com.inboxflow.repository;

import com.inboxflow.model.Contact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ContactRepository extends JpaRepository<Contact, UUID> {

    Optional<Contact> findByTenantIdAndPhone(UUID tenantId, String phone);
}
