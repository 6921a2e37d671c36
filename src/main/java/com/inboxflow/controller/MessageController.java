package com.inboxflow.controller;

import com.inboxflow.dto.OutboundMessageRequest;
import com.inboxflow.dto.OutboundMessageResponse;
import com.inboxflow.model.Message;
import com.inboxflow.service.OutboundMessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Queues an outbound message. The send itself happens asynchronously, so the
 * response is 202 with the message still PENDING.
 *
 * POST /api/messages   (X-Tenant-Id: ...)
 * {"to": "+15551234567", "type": "TEXT", "text": "Your order has shipped"}
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
public class MessageController {

    private final OutboundMessageService outboundMessageService;

    @PostMapping
    public ResponseEntity<OutboundMessageResponse> send(
            @RequestHeader(FlowController.TENANT_HEADER) UUID tenantId,
            @Valid @RequestBody OutboundMessageRequest request) {
        Message message = outboundMessageService.queue(tenantId, request);
        return ResponseEntity.accepted().body(OutboundMessageResponse.builder()
                .id(message.getId())
                .conversationId(message.getConversationId())
                .status(message.getStatus())
                .build());
    }
}
