package com.inboxflow.service.flow;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.dto.FlowTriggerContext;
import com.inboxflow.model.Flow;
import com.inboxflow.model.FlowExecution;
import com.inboxflow.model.FlowTriggerType;
import com.inboxflow.repository.FlowExecutionRepository;
import com.inboxflow.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which flows an inbound message starts, and records one PENDING
 * FlowExecution per match. Nothing runs here: the execution poller picks the
 * rows up after the inbound transaction commits.
 *
 * Button replies are different: the reply id sent with a flow message encodes
 * where the flow stopped,
 *
 *   flow-{flowId}-node-{nodeId}-btn-{buttonId}
 *
 * so a reply creates an execution that resumes at that node rather than
 * starting a new run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowTriggerService {

    private static final Pattern BUTTON_PAYLOAD = Pattern.compile(
            "^flow-([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})-node-(.+?)-btn-(.+)$");

    public static final String LAST_BUTTON_CLICK = "lastButtonClick";

    private final FlowRepository flowRepository;
    private final FlowExecutionRepository flowExecutionRepository;
    private final InboxflowProperties properties;

    public static String buttonPayload(UUID flowId, String nodeId, String buttonId) {
        return "flow-" + flowId + "-node-" + nodeId + "-btn-" + buttonId;
    }

    public boolean isFlowButtonPayload(String payload) {
        return payload != null && BUTTON_PAYLOAD.matcher(payload).matches();
    }

    @Transactional
    public List<UUID> triggerFlows(UUID tenantId, FlowTriggerType triggerType, FlowTriggerContext context) {
        List<Flow> candidates = flowRepository.findByTenantIdAndTriggerTypeAndActiveTrue(tenantId, triggerType);
        List<UUID> created = new ArrayList<>();

        for (Flow flow : candidates) {
            if (triggerType == FlowTriggerType.KEYWORD
                    && !matchesKeywords(flow.getTriggerKeywords(), context.getMessageBody())) {
                continue;
            }

            Map<String, Object> triggerData = new LinkedHashMap<>();
            triggerData.put("triggerType", triggerType.name());
            if (context.getContactId() != null) {
                triggerData.put("contactId", context.getContactId().toString());
            }

            FlowExecution execution = flowExecutionRepository.save(baseExecution(flow.getId(), tenantId, context)
                    .triggeredBy(triggerType)
                    .triggerData(triggerData)
                    .build());
            created.add(execution.getId());
            log.info("Flow '{}' ({}) triggered by {} for {}: execution={}",
                    flow.getName(), flow.getId(), triggerType, context.getContactPhone(), execution.getId());
        }
        return created;
    }

    /**
     * Resumes a flow from the node whose button was clicked.
     * Returns empty when the payload is not a flow button or the flow is not the tenant's.
     */
    @Transactional
    public Optional<UUID> handleButtonClick(UUID tenantId, String contactPhone, String payload,
                                            FlowTriggerContext context) {
        if (payload == null) {
            return Optional.empty();
        }
        Matcher matcher = BUTTON_PAYLOAD.matcher(payload);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        UUID flowId = UUID.fromString(matcher.group(1));
        String nodeId = matcher.group(2);
        String buttonId = matcher.group(3);

        if (flowRepository.findByIdAndTenantId(flowId, tenantId).isEmpty()) {
            log.warn("Button reply for unknown flow {} (tenant {}), ignoring", flowId, tenantId);
            return Optional.empty();
        }

        Map<String, Object> triggerData = new LinkedHashMap<>();
        triggerData.put("buttonId", buttonId);
        triggerData.put("buttonPayload", payload);

        Map<String, Object> state = new LinkedHashMap<>();
        state.put(LAST_BUTTON_CLICK, buttonId);

        FlowExecution execution = flowExecutionRepository.save(baseExecution(flowId, tenantId, context)
                .contactPhone(contactPhone)
                .triggeredBy(FlowTriggerType.BUTTON_CLICK)
                .triggerData(triggerData)
                .currentNodeId(nodeId)
                .executionState(state)
                .build());

        log.info("Button '{}' on node {} resumes flow {}: execution={}", buttonId, nodeId, flowId, execution.getId());
        return Optional.of(execution.getId());
    }

    /**
     * Keywords are comma separated and compared lower-cased; blank entries are ignored.
     * Matching is by substring, so "help" also matches "helpful".
     */
    static boolean matchesKeywords(String keywords, String body) {
        if (keywords == null || body == null) {
            return false;
        }
        String haystack = body.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(keywords.split(","))
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .anyMatch(haystack::contains);
    }

    private FlowExecution.FlowExecutionBuilder baseExecution(UUID flowId, UUID tenantId, FlowTriggerContext context) {
        return FlowExecution.builder()
                .flowId(flowId)
                .tenantId(tenantId)
                .contactPhone(context.getContactPhone())
                .conversationId(context.getConversationId())
                .messageBody(context.getMessageBody())
                .messageType(context.getMessageType())
                .maxRetries(properties.getFlows().getMaxRetries());
    }
}
