package com.inboxflow.service.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.dto.FlowRequest;
import com.inboxflow.dto.FlowResponse;
import com.inboxflow.exception.FlowDefinitionException;
import com.inboxflow.model.Flow;
import com.inboxflow.model.FlowTriggerType;
import com.inboxflow.repository.FlowRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class FlowService {

    private final FlowRepository flowRepository;
    private final FlowDefinitionParser parser;
    private final ObjectMapper objectMapper;

    @Transactional
    public FlowResponse create(UUID tenantId, FlowRequest request) {
        validate(request);

        Flow flow = Flow.builder()
                .tenantId(tenantId)
                .name(request.getName())
                .description(request.getDescription())
                .triggerType(request.getTriggerType())
                .triggerKeywords(request.getTriggerKeywords())
                .nodes(request.getNodes().toString())
                .edges(request.getEdges().toString())
                .active(request.getActive() == null || request.getActive())
                .build();

        return toResponse(flowRepository.save(flow));
    }

    @Transactional(readOnly = true)
    public List<FlowResponse> list(UUID tenantId) {
        return flowRepository.findByTenantIdOrderByCreatedAtDesc(tenantId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public FlowResponse get(UUID tenantId, UUID id) {
        return toResponse(find(tenantId, id));
    }

    @Transactional
    public FlowResponse update(UUID tenantId, UUID id, FlowRequest request) {
        Flow flow = find(tenantId, id);
        validate(request);

        flow.setName(request.getName());
        flow.setDescription(request.getDescription());
        flow.setTriggerType(request.getTriggerType());
        flow.setTriggerKeywords(request.getTriggerKeywords());
        flow.setNodes(request.getNodes().toString());
        flow.setEdges(request.getEdges().toString());
        if (request.getActive() != null) {
            flow.setActive(request.getActive());
        }

        return toResponse(flowRepository.save(flow));
    }

    @Transactional
    public void delete(UUID tenantId, UUID id) {
        flowRepository.delete(find(tenantId, id));
    }

    /** Pausing stops new triggers; executions already queued still run to the end. */
    @Transactional
    public FlowResponse toggleActive(UUID tenantId, UUID id) {
        Flow flow = find(tenantId, id);
        flow.setActive(!flow.isActive());
        return toResponse(flowRepository.save(flow));
    }

    /** Tenant-scoped lookup; another tenant's flow is reported as not found. */
    @Transactional(readOnly = true)
    public Flow find(UUID tenantId, UUID id) {
        return flowRepository.findByIdAndTenantId(id, tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Flow not found: " + id));
    }

    private void validate(FlowRequest request) {
        parser.parseRunnable(request.getNodes(), request.getEdges());

        if (request.getTriggerType() == FlowTriggerType.KEYWORD) {
            String keywords = request.getTriggerKeywords();
            boolean hasKeyword = keywords != null
                    && List.of(keywords.split(",")).stream().anyMatch(k -> !k.isBlank());
            if (!hasKeyword) {
                throw new FlowDefinitionException("KEYWORD flows need at least one trigger keyword");
            }
        }
    }

    // --- Mapping helpers ---

    private FlowResponse toResponse(Flow f) {
        return FlowResponse.builder()
                .id(f.getId())
                .name(f.getName())
                .description(f.getDescription())
                .triggerType(f.getTriggerType())
                .triggerKeywords(f.getTriggerKeywords())
                .nodes(readJson(f.getNodes()))
                .edges(readJson(f.getEdges()))
                .active(f.isActive())
                .runsCount(f.getRunsCount())
                .createdAt(f.getCreatedAt())
                .updatedAt(f.getUpdatedAt())
                .build();
    }

    private JsonNode readJson(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FlowDefinitionException("Stored flow definition is not valid JSON", e);
        }
    }
}
