package com.inboxflow.service.inbound;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.UnresolvedTenantException;
import com.inboxflow.model.RawEvent;
import com.inboxflow.model.RawEventStatus;
import com.inboxflow.repository.RawEventRepository;
import com.inboxflow.service.TenantDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookEventProcessorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static final String MESSAGES_CHANGE = "{\"field\":\"messages\",\"value\":{"
            + "\"contacts\":[{\"wa_id\":\"15551234567\",\"profile\":{\"name\":\"Ada\"}}],"
            + "\"messages\":[{\"id\":\"wamid.1\",\"from\":\"15551234567\",\"text\":{\"body\":\"hi\"}}],"
            + "\"statuses\":[{\"id\":\"wamid.0\",\"status\":\"read\"}]}}";

    @Mock private RawEventRepository rawEventRepository;
    @Mock private TenantDirectory tenantDirectory;
    @Mock private InboundMessageHandler inboundMessageHandler;
    @Mock private StatusUpdateHandler statusUpdateHandler;
    @Mock private TemplateStatusHandler templateStatusHandler;

    private WebhookEventProcessor processor;
    private final UUID rawEventId = UUID.randomUUID();
    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        processor = new WebhookEventProcessor(rawEventRepository, tenantDirectory, inboundMessageHandler,
                statusUpdateHandler, templateStatusHandler, new ObjectMapper(), new InboxflowProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private RawEvent rawEvent(UUID tenant, String payload) {
        return RawEvent.builder()
                .id(rawEventId)
                .tenantId(tenant)
                .routingKey("pn-1")
                .payload(payload)
                .status(RawEventStatus.PROCESSING)
                .build();
    }

    private void givenClaimed(RawEvent event) {
        when(rawEventRepository.claim(rawEventId, 5, NOW, RawEventStatus.PROCESSING,
                RawEventStatus.PENDING, RawEventStatus.FAILED)).thenReturn(1);
        when(rawEventRepository.findById(rawEventId)).thenReturn(Optional.of(event));
    }

    @Test
    @DisplayName("Routes messages and statuses to their handlers, then marks PROCESSED")
    void processesChange() {
        givenClaimed(rawEvent(tenantId, MESSAGES_CHANGE));

        WebhookEventProcessor.Outcome outcome = processor.process(rawEventId);

        assertEquals(WebhookEventProcessor.Outcome.PROCESSED, outcome);
        verify(inboundMessageHandler).handle(eq(tenantId), eq("pn-1"), any(), eq("Ada"));
        verify(statusUpdateHandler).handle(eq(tenantId), any());
        verify(rawEventRepository).markProcessed(rawEventId, RawEventStatus.PROCESSED, NOW);
    }

    @Test
    @DisplayName("Template status changes go to the template handler only")
    void templateStatusChange() {
        givenClaimed(rawEvent(tenantId, "{\"field\":\"message_template_status_update\",\"value\":{\"event\":\"APPROVED\"}}"));

        processor.process(rawEventId);

        verify(templateStatusHandler).handle(eq(tenantId), any());
        verifyNoInteractions(inboundMessageHandler, statusUpdateHandler);
    }

    @Test
    @DisplayName("A row without a tenant is resolved and the tenant written back")
    void resolvesTenantLate() {
        givenClaimed(rawEvent(null, MESSAGES_CHANGE));
        when(tenantDirectory.resolveTenantId("pn-1")).thenReturn(Optional.of(tenantId));

        processor.process(rawEventId);

        verify(rawEventRepository).assignTenant(rawEventId, tenantId);
        verify(inboundMessageHandler).handle(eq(tenantId), eq("pn-1"), any(), eq("Ada"));
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("An unknown routing key fails the row with a non-retryable error")
        void unresolvedTenant() {
            givenClaimed(rawEvent(null, MESSAGES_CHANGE));
            when(tenantDirectory.resolveTenantId("pn-1")).thenReturn(Optional.empty());

            UnresolvedTenantException e = assertThrows(UnresolvedTenantException.class,
                    () -> processor.process(rawEventId));

            assertFalse(e.isRetryable());
            verify(rawEventRepository).markFailed(eq(rawEventId), eq(RawEventStatus.FAILED), anyString());
            verifyNoInteractions(inboundMessageHandler);
        }

        @Test
        @DisplayName("A handler failure marks the row FAILED and rethrows")
        void handlerFailure() {
            givenClaimed(rawEvent(tenantId, MESSAGES_CHANGE));
            when(inboundMessageHandler.handle(any(), any(), any(), any()))
                    .thenThrow(new IllegalStateException("constraint violation"));

            assertThrows(IllegalStateException.class, () -> processor.process(rawEventId));

            verify(rawEventRepository).markFailed(rawEventId, RawEventStatus.FAILED, "constraint violation");
            verify(rawEventRepository, never()).markProcessed(any(), any(), any());
        }

        @Test
        @DisplayName("A job for a row that does not exist is a missing record")
        void missingRow() {
            when(rawEventRepository.claim(eq(rawEventId), anyInt(), any(), any(), any(), any())).thenReturn(0);
            when(rawEventRepository.findById(rawEventId)).thenReturn(Optional.empty());

            assertThrows(MissingRecordException.class, () -> processor.process(rawEventId));
        }

        @Test
        @DisplayName("A row someone else already handled is skipped")
        void alreadyProcessed() {
            RawEvent done = rawEvent(tenantId, MESSAGES_CHANGE);
            done.setStatus(RawEventStatus.PROCESSED);
            when(rawEventRepository.claim(eq(rawEventId), anyInt(), any(), any(), any(), any())).thenReturn(0);
            when(rawEventRepository.findById(rawEventId)).thenReturn(Optional.of(done));

            assertEquals(WebhookEventProcessor.Outcome.SKIPPED, processor.process(rawEventId));
            verifyNoInteractions(inboundMessageHandler, statusUpdateHandler, templateStatusHandler);
        }
    }
}
