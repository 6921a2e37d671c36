package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.model.MessageTemplate;
import com.inboxflow.model.TemplateStatus;
import com.inboxflow.repository.MessageTemplateRepository;
import com.inboxflow.service.RealtimeEventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TemplateStatusHandlerTest {

    @Mock private MessageTemplateRepository templateRepository;
    @Mock private RealtimeEventPublisher realtimeEventPublisher;

    @InjectMocks
    private TemplateStatusHandler handler;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final UUID tenantId = UUID.randomUUID();

    @Test
    @DisplayName("A rejection is recorded with its reason and announced")
    void rejected() throws Exception {
        MessageTemplate template = MessageTemplate.builder()
                .id(UUID.randomUUID()).tenantId(tenantId).externalId("1234").name("order_update").language("en_US").build();
        when(templateRepository.findByTenantIdAndExternalId(tenantId, "1234")).thenReturn(Optional.of(template));

        boolean changed = handler.handle(tenantId, objectMapper.readTree("{\"event\":\"REJECTED\","
                + "\"message_template_id\":1234,\"message_template_name\":\"order_update\","
                + "\"message_template_language\":\"en_US\",\"reason\":\"INVALID_FORMAT\"}"));

        assertTrue(changed);
        assertEquals(TemplateStatus.REJECTED, template.getStatus());
        assertEquals("INVALID_FORMAT", template.getRejectionReason());
        verify(realtimeEventPublisher).publish(eq(RealtimeEventType.NOTIFICATION_NEW), eq(tenantId), anyMap());
    }

    @Test
    @DisplayName("Falls back to name and language, and adopts the provider id")
    void matchesByNameAndLanguage() throws Exception {
        MessageTemplate template = MessageTemplate.builder()
                .id(UUID.randomUUID()).tenantId(tenantId).name("welcome").language("en_US").build();
        when(templateRepository.findByTenantIdAndExternalId(tenantId, "999")).thenReturn(Optional.empty());
        when(templateRepository.findByTenantIdAndNameAndLanguage(tenantId, "welcome", "en_US"))
                .thenReturn(Optional.of(template));

        handler.handle(tenantId, objectMapper.readTree("{\"event\":\"APPROVED\",\"message_template_id\":999,"
                + "\"message_template_name\":\"welcome\",\"message_template_language\":\"en_US\",\"reason\":\"NONE\"}"));

        assertEquals(TemplateStatus.APPROVED, template.getStatus());
        assertEquals("999", template.getExternalId());
        assertNull(template.getRejectionReason());
    }

    @Test
    @DisplayName("Unknown events and unknown templates are ignored")
    void ignored() throws Exception {
        assertFalse(handler.handle(tenantId, objectMapper.readTree("{\"event\":\"FLAGGED_FOR_LUNCH\"}")));

        when(templateRepository.findByTenantIdAndExternalId(tenantId, "1")).thenReturn(Optional.empty());
        assertFalse(handler.handle(tenantId, objectMapper.readTree("{\"event\":\"APPROVED\",\"message_template_id\":1}")));
        verify(templateRepository, never()).save(any());
    }
}
