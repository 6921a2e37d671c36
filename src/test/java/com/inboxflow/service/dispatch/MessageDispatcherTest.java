package com.inboxflow.service.dispatch;

import com.inboxflow.dto.ConsumeResult;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.exception.CredentialUnavailableException;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.ProviderRejectionException;
import com.inboxflow.exception.ProcessingException;
import com.inboxflow.exception.RateLimitedException;
import com.inboxflow.exception.UnrecordedSendException;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageDirection;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.model.MessageType;
import com.inboxflow.model.ProviderCredential;
import com.inboxflow.model.Tenant;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.repository.ProviderCredentialRepository;
import com.inboxflow.repository.TenantRepository;
import com.inboxflow.service.RealtimeEventPublisher;
import com.inboxflow.service.ratelimit.TenantRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for MessageDispatcher.
 *
 * Verifies:
 *   1. Only PENDING messages are sent
 *   2. An empty send bucket leaves the message PENDING and raises a rate-limit error
 *   3. A successful send records the provider id and SENT
 *   4. Auth rejections invalidate the credential and fail the message
 *   5. Retryable provider errors keep the message PENDING
 *   6. A send the provider accepted is never retried, even if saving it fails
 */
@ExtendWith(MockitoExtension.class)
class MessageDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock private MessageRepository messageRepository;
    @Mock private TenantRepository tenantRepository;
    @Mock private ProviderCredentialRepository credentialRepository;
    @Mock private TenantRateLimiter rateLimiter;
    @Mock private CredentialCipher credentialCipher;
    @Mock private ProviderPayloadBuilder payloadBuilder;
    @Mock private WhatsAppCloudClient cloudClient;
    @Mock private RealtimeEventPublisher realtimeEventPublisher;

    private MessageDispatcher dispatcher;

    private final UUID tenantId = UUID.randomUUID();
    private Message message;
    private ProviderCredential credential;

    @BeforeEach
    void setUp() {
        dispatcher = new MessageDispatcher(messageRepository, tenantRepository, credentialRepository, rateLimiter,
                credentialCipher, payloadBuilder, cloudClient, realtimeEventPublisher, Clock.fixed(NOW, ZoneOffset.UTC));
        message = Message.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .conversationId(UUID.randomUUID())
                .direction(MessageDirection.OUTBOUND)
                .status(MessageStatus.PENDING)
                .type(MessageType.TEXT)
                .to("+15551234567")
                .text("hello")
                .build();
        credential = ProviderCredential.builder()
                .id(UUID.randomUUID())
                .tenantId(tenantId)
                .phoneNumberId("pn-1")
                .accessToken("enc")
                .build();
    }

    private void givenQuota(boolean allowed) {
        when(messageRepository.findById(message.getId())).thenReturn(Optional.of(message));
        when(tenantRepository.findById(tenantId))
                .thenReturn(Optional.of(Tenant.builder().id(tenantId).messagesPerMinute(60).build()));
        when(rateLimiter.consume(tenantId, 60, 1))
                .thenReturn(new ConsumeResult(allowed, allowed ? 59 : 0, allowed ? 0 : 1));
    }

    private void givenCredential() {
        when(credentialRepository.findFirstByTenantIdAndValidTrue(tenantId)).thenReturn(Optional.of(credential));
        when(credentialCipher.decrypt("enc")).thenReturn("token");
        when(payloadBuilder.build(message)).thenReturn(Map.of("type", "text"));
    }

    @Test
    @DisplayName("A message that is no longer PENDING is not sent again")
    void nonPendingIsSkipped() {
        message.setStatus(MessageStatus.SENT);
        when(messageRepository.findById(message.getId())).thenReturn(Optional.of(message));

        assertEquals(MessageDispatcher.Outcome.SKIPPED, dispatcher.dispatch(message.getId()));
        verifyNoInteractions(rateLimiter, cloudClient);
    }

    @Test
    @DisplayName("A deleted message is a missing record")
    void missingMessage() {
        when(messageRepository.findById(message.getId())).thenReturn(Optional.empty());

        assertThrows(MissingRecordException.class, () -> dispatcher.dispatch(message.getId()));
    }

    @Test
    @DisplayName("Success records the provider id, sender and SENT")
    void sendSucceeds() {
        givenQuota(true);
        givenCredential();
        when(cloudClient.send(eq("pn-1"), eq("token"), anyMap())).thenReturn("wamid.out");

        assertEquals(MessageDispatcher.Outcome.SENT, dispatcher.dispatch(message.getId()));

        assertEquals(MessageStatus.SENT, message.getStatus());
        assertEquals("wamid.out", message.getExternalMessageId());
        assertEquals("pn-1", message.getFrom());
        assertEquals(NOW, message.getSentAt());
        verify(realtimeEventPublisher).publish(eq(RealtimeEventType.CONVERSATION_UPDATED), eq(tenantId), anyMap());
    }

    @Test
    @DisplayName("A save that fails after the provider accepted the message is not retried")
    void acceptedButNotRecorded() {
        givenQuota(true);
        givenCredential();
        when(cloudClient.send(eq("pn-1"), eq("token"), anyMap())).thenReturn("wamid.out");
        when(messageRepository.save(message)).thenThrow(new QueryTimeoutException("db down"));

        UnrecordedSendException error =
                assertThrows(UnrecordedSendException.class, () -> dispatcher.dispatch(message.getId()));

        assertFalse(ProcessingException.isRetryable(error));
        assertEquals("wamid.out", error.getExternalMessageId());
        verify(cloudClient, times(1)).send(any(), any(), anyMap());
        verify(messageRepository, times(1)).save(any());
        verifyNoInteractions(realtimeEventPublisher);
    }

    @Test
    @DisplayName("An empty bucket leaves the message PENDING")
    void rateLimited() {
        givenQuota(false);

        RateLimitedException e = assertThrows(RateLimitedException.class, () -> dispatcher.dispatch(message.getId()));

        assertEquals(1000, e.getRetryAfterMillis());
        assertEquals(MessageStatus.PENDING, message.getStatus());
        verifyNoInteractions(cloudClient);
        verify(messageRepository, never()).save(any());
    }

    @Test
    @DisplayName("No valid credential fails the message at once")
    void noCredential() {
        givenQuota(true);
        when(credentialRepository.findFirstByTenantIdAndValidTrue(tenantId)).thenReturn(Optional.empty());

        assertThrows(CredentialUnavailableException.class, () -> dispatcher.dispatch(message.getId()));

        assertEquals(MessageStatus.FAILED, message.getStatus());
        assertEquals(NOW, message.getFailedAt());
    }

    @Nested
    @DisplayName("Provider rejections")
    class Rejections {

        @Test
        @DisplayName("HTTP 401 invalidates the credential and fails the message")
        void authInvalid() {
            givenQuota(true);
            givenCredential();
            when(cloudClient.send(anyString(), anyString(), anyMap())).thenThrow(new ProviderRejectionException(
                    ProviderRejectionException.Kind.AUTH_INVALID, 401, 190, "token expired"));

            assertThrows(ProviderRejectionException.class, () -> dispatcher.dispatch(message.getId()));

            verify(credentialRepository).invalidate(credential.getId(), "token expired", NOW);
            assertEquals(MessageStatus.FAILED, message.getStatus());
        }

        @Test
        @DisplayName("Provider throttling keeps the message PENDING with the error")
        void providerThrottled() {
            givenQuota(true);
            givenCredential();
            when(cloudClient.send(anyString(), anyString(), anyMap())).thenThrow(new ProviderRejectionException(
                    ProviderRejectionException.Kind.RATE_LIMITED, 429, 130429, "slow down"));

            assertThrows(ProviderRejectionException.class, () -> dispatcher.dispatch(message.getId()));

            assertEquals(MessageStatus.PENDING, message.getStatus());
            assertEquals("slow down", message.getErrorMessage());
            verify(credentialRepository, never()).invalidate(any(), any(), any());
        }
    }

    @Test
    @DisplayName("Abandoning only fails a message that is still PENDING")
    void markAbandoned() {
        when(messageRepository.findById(message.getId())).thenReturn(Optional.of(message));

        dispatcher.markAbandoned(message.getId(), "Gave up after 5 attempts");

        assertEquals(MessageStatus.FAILED, message.getStatus());
        assertEquals("Gave up after 5 attempts", message.getErrorMessage());
    }
}
