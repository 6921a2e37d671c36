package com.inboxflow.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.service.WebhookIngestionService;
import com.inboxflow.service.WebhookSignatureVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;

/**
 * Provider webhook endpoint.
 *
 * GET  /api/webhook?hub.mode=subscribe&hub.verify_token=...&hub.challenge=123
 *   → 200 "123" when the token matches, 403 otherwise
 *
 * POST /api/webhook
 * {
 *   "object": "whatsapp_business_account",
 *   "entry": [{"id": "WABA_ID", "changes": [{"field": "messages", "value": {...}}]}]
 * }
 *   → 200 once the changes are persisted (or could not be, see WebhookIngestionService)
 *   → 400 for a body that is not a business account webhook
 *   → 403 when signature checking is on and the signature does not match
 */
@RestController
@RequestMapping("/api/webhook")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String WEBHOOK_OBJECT = "whatsapp_business_account";

    private final WebhookIngestionService ingestionService;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @GetMapping
    public ResponseEntity<String> verify(
            @RequestParam(name = "hub.mode", required = false) String hubMode,
            @RequestParam(name = "hub.verify_token", required = false) String hubToken,
            @RequestParam(name = "hub.challenge", required = false) String hubChallenge,
            @RequestParam(name = "mode", required = false) String mode,
            @RequestParam(name = "verify_token", required = false) String token,
            @RequestParam(name = "challenge", required = false) String challenge) {

        String effectiveMode = hubMode != null ? hubMode : mode;
        String effectiveToken = hubToken != null ? hubToken : token;
        String effectiveChallenge = hubChallenge != null ? hubChallenge : challenge;

        if (ingestionService.verifySubscription(effectiveMode, effectiveToken)) {
            log.info("Webhook subscription verified");
            return ResponseEntity.ok(effectiveChallenge == null ? "" : effectiveChallenge);
        }
        log.warn("Webhook verification failed: mode={}", effectiveMode);
        return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
    }

    @PostMapping
    public ResponseEntity<Void> receive(
            @RequestBody byte[] body,
            @RequestHeader(name = "X-Hub-Signature-256", required = false) String signature) {

        if (!signatureVerifier.isValid(body, signature)) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            log.warn("Webhook body is not JSON: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }
        if (root == null || !WEBHOOK_OBJECT.equals(root.path("object").asText())) {
            log.warn("Webhook for unexpected object '{}' rejected", root == null ? null : root.path("object").asText());
            return ResponseEntity.badRequest().build();
        }

        ingestionService.ingest(root);
        return ResponseEntity.ok().build();
    }
}
