package com.inboxflow.service;

import com.inboxflow.config.InboxflowProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks {@code X-Hub-Signature-256: sha256=<hex HMAC-SHA256(app secret, raw body)>}.
 *
 * Verification is only enforced when inboxflow.webhook.app-secret is configured.
 * Comparison is constant-time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookSignatureVerifier {

    private static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    private final InboxflowProperties properties;

    public boolean isValid(byte[] body, String signatureHeader) {
        String secret = properties.getWebhook().getAppSecret();
        if (secret == null || secret.isBlank()) {
            return true;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
            log.warn("Webhook rejected: missing or malformed signature header");
            return false;
        }

        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] expected = mac.doFinal(body);
            byte[] provided = HexFormat.of().parseHex(signatureHeader.substring(PREFIX.length()));
            boolean valid = MessageDigest.isEqual(expected, provided);
            if (!valid) {
                log.warn("Webhook rejected: signature mismatch");
            }
            return valid;
        } catch (IllegalArgumentException e) {
            log.warn("Webhook rejected: signature is not hex");
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }
}
