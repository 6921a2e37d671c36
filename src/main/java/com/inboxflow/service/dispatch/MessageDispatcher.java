package com.inboxflow.service.dispatch;

import com.inboxflow.dto.ConsumeResult;
import com.inboxflow.dto.RealtimeEventType;
import com.inboxflow.exception.CredentialUnavailableException;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.exception.ProcessingException;
import com.inboxflow.exception.ProviderRejectionException;
import com.inboxflow.exception.RateLimitedException;
import com.inboxflow.exception.UnrecordedSendException;
import com.inboxflow.model.Message;
import com.inboxflow.model.MessageStatus;
import com.inboxflow.model.ProviderCredential;
import com.inboxflow.model.Tenant;
import com.inboxflow.repository.MessageRepository;
import com.inboxflow.repository.ProviderCredentialRepository;
import com.inboxflow.repository.TenantRepository;
import com.inboxflow.service.RealtimeEventPublisher;
import com.inboxflow.service.ratelimit.TenantRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Sends one PENDING outbound message to the provider.
 *
 * FLOW:
 *   1. Load the message; anything but PENDING is a no-op (already sent or failed)
 *   2. Take one token from the tenant's bucket; empty → RateLimitedException,
 *      the message stays PENDING
 *   3. Find the tenant's valid credential and decrypt its token
 *   4. Build the payload, call the provider
 *   5. Success → externalMessageId, SENT, sentAt
 *
 * Failures:
 *   retryable (provider throttling, 5xx, network) → stays PENDING with the error, rethrown
 *   terminal (bad parameter, undeliverable, no credential) → FAILED, rethrown
 *   auth rejected → the credential is invalidated as well, so later sends fail fast
 *   accepted but not saved → UnrecordedSendException, never retried
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageDispatcher {

    public enum Outcome {
        SENT,
        SKIPPED
    }

    private final MessageRepository messageRepository;
    private final TenantRepository tenantRepository;
    private final ProviderCredentialRepository credentialRepository;
    private final TenantRateLimiter rateLimiter;
    private final CredentialCipher credentialCipher;
    private final ProviderPayloadBuilder payloadBuilder;
    private final WhatsAppCloudClient cloudClient;
    private final RealtimeEventPublisher realtimeEventPublisher;
    private final Clock clock;

    public Outcome dispatch(UUID messageId) {
        Message message = messageRepository.findById(messageId)
                .orElseThrow(() -> new MissingRecordException("Message", messageId));

        if (message.getStatus() != MessageStatus.PENDING) {
            log.info("Message {} is {}, nothing to send", messageId, message.getStatus());
            return Outcome.SKIPPED;
        }

        UUID tenantId = message.getTenantId();
        Integer perMinute = tenantRepository.findById(tenantId)
                .map(Tenant::getMessagesPerMinute)
                .orElse(null);
        ConsumeResult quota = rateLimiter.consume(tenantId, perMinute, 1);
        if (!quota.isAllowed()) {
            throw new RateLimitedException(tenantId.toString(), quota.getRetryAfterSeconds());
        }

        ProviderCredential credential = credentialRepository.findFirstByTenantIdAndValidTrue(tenantId).orElse(null);
        if (credential == null) {
            CredentialUnavailableException error =
                    new CredentialUnavailableException("Tenant " + tenantId + " has no valid provider credential");
            markFailed(message, error.getMessage());
            throw error;
        }

        String externalId;
        try {
            String accessToken = credentialCipher.decrypt(credential.getAccessToken());
            Map<String, Object> payload = payloadBuilder.build(message);
            externalId = cloudClient.send(credential.getPhoneNumberId(), accessToken, payload);
        } catch (ProviderRejectionException e) {
            if (e.getKind() == ProviderRejectionException.Kind.AUTH_INVALID) {
                credentialRepository.invalidate(credential.getId(), e.getMessage(), clock.instant());
                log.error("Credential {} of tenant {} invalidated: {}", credential.getId(), tenantId, e.getMessage());
            }
            recordFailure(message, e);
            throw e;
        } catch (RuntimeException e) {
            recordFailure(message, e);
            throw e;
        }

        recordSent(message, credential.getPhoneNumberId(), externalId);
        return Outcome.SENT;
    }

    // The provider already has the message: a failure from here on must not lead to a resend
    private void recordSent(Message message, String phoneNumberId, String externalId) {
        message.setExternalMessageId(externalId);
        message.setFrom(phoneNumberId);
        message.setStatus(MessageStatus.SENT);
        message.setSentAt(clock.instant());
        message.setErrorMessage(null);
        try {
            messageRepository.save(message);
        } catch (RuntimeException e) {
            log.error("Message {} sent as {} but not recorded: {}", message.getId(), externalId, e.getMessage(), e);
            throw new UnrecordedSendException(message.getId(), externalId, e);
        }
        log.info("Message {} sent: externalId={}", message.getId(), externalId);
        publishStatus(message);
    }

    /** Retries are used up: the message will not be attempted again. */
    public void markAbandoned(UUID messageId, String error) {
        messageRepository.findById(messageId)
                .filter(m -> m.getStatus() == MessageStatus.PENDING)
                .ifPresent(m -> markFailed(m, error));
    }

    private void recordFailure(Message message, RuntimeException error) {
        String text = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        if (ProcessingException.isRetryable(error)) {
            message.setErrorMessage(text);
            messageRepository.save(message);
            log.warn("Send of message {} failed, will retry: {}", message.getId(), text);
        } else {
            markFailed(message, text);
        }
    }

    private void markFailed(Message message, String error) {
        message.setStatus(MessageStatus.FAILED);
        message.setErrorMessage(error);
        message.setFailedAt(clock.instant());
        messageRepository.save(message);
        log.error("Message {} failed: {}", message.getId(), error);
        publishStatus(message);
    }

    private void publishStatus(Message message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("conversationId", message.getConversationId());
        data.put("messageId", message.getId());
        data.put("status", message.getStatus().name());
        realtimeEventPublisher.publish(RealtimeEventType.CONVERSATION_UPDATED, message.getTenantId(), data);
    }
}
