package com.inboxflow.controller;

import com.inboxflow.dto.FlowExecutionResponse;
import com.inboxflow.dto.FlowExecutionStatsResponse;
import com.inboxflow.dto.FlowRequest;
import com.inboxflow.dto.FlowResponse;
import com.inboxflow.service.flow.FlowExecutionService;
import com.inboxflow.service.flow.FlowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final FlowService flowService;
    private final FlowExecutionService flowExecutionService;

    @PostMapping
    public ResponseEntity<FlowResponse> create(
            @RequestHeader(TENANT_HEADER) UUID tenantId, @Valid @RequestBody FlowRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(flowService.create(tenantId, request));
    }

    @GetMapping
    public ResponseEntity<List<FlowResponse>> list(@RequestHeader(TENANT_HEADER) UUID tenantId) {
        return ResponseEntity.ok(flowService.list(tenantId));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FlowResponse> get(@RequestHeader(TENANT_HEADER) UUID tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(flowService.get(tenantId, id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<FlowResponse> update(
            @RequestHeader(TENANT_HEADER) UUID tenantId,
            @PathVariable UUID id, @Valid @RequestBody FlowRequest request) {
        return ResponseEntity.ok(flowService.update(tenantId, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(TENANT_HEADER) UUID tenantId, @PathVariable UUID id) {
        flowService.delete(tenantId, id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}/toggle")
    public ResponseEntity<FlowResponse> toggleActive(
            @RequestHeader(TENANT_HEADER) UUID tenantId, @PathVariable UUID id) {
        return ResponseEntity.ok(flowService.toggleActive(tenantId, id));
    }

    @GetMapping("/{id}/executions")
    public ResponseEntity<List<FlowExecutionResponse>> executions(
            @RequestHeader(TENANT_HEADER) UUID tenantId, @PathVariable UUID id,
            @RequestParam(defaultValue = "50") int limit) {
        flowService.find(tenantId, id);
        return ResponseEntity.ok(flowExecutionService.recent(id, Math.max(1, Math.min(limit, 200))));
    }

    @GetMapping("/{id}/executions/stats")
    public ResponseEntity<FlowExecutionStatsResponse> executionStats(
            @RequestHeader(TENANT_HEADER) UUID tenantId, @PathVariable UUID id) {
        flowService.find(tenantId, id);
        return ResponseEntity.ok(flowExecutionService.stats(id));
    }
}
