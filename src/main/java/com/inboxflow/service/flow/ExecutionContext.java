package com.inboxflow.service.flow;

import com.inboxflow.model.FlowExecution;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only view of one execution's data, shared by every branch of a traversal.
 *
 * Condition nodes see {@link #getVariables()}: the trigger fields, the trigger
 * data under "triggerData", then the persisted execution state laid over them.
 */
@Getter
public final class ExecutionContext {

    private final UUID executionId;
    private final UUID flowId;
    private final UUID tenantId;
    private final String contactPhone;
    private final UUID conversationId;
    private final Map<String, Object> state;
    private final Map<String, Object> variables;

    private ExecutionContext(FlowExecution execution) {
        this.executionId = execution.getId();
        this.flowId = execution.getFlowId();
        this.tenantId = execution.getTenantId();
        this.contactPhone = execution.getContactPhone();
        this.conversationId = execution.getConversationId();
        this.state = copyOf(execution.getExecutionState());

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("contactPhone", nullToEmpty(execution.getContactPhone()));
        vars.put("messageBody", nullToEmpty(execution.getMessageBody()));
        vars.put("messageType", nullToEmpty(execution.getMessageType()));
        vars.put("triggeredBy", execution.getTriggeredBy() == null ? "" : execution.getTriggeredBy().name());
        vars.put("triggerData", copyOf(execution.getTriggerData()));
        vars.putAll(this.state);
        this.variables = Collections.unmodifiableMap(vars);
    }

    public static ExecutionContext of(FlowExecution execution) {
        return new ExecutionContext(execution);
    }

    public String stateValue(String key) {
        Object value = state.get(key);
        return value == null ? null : value.toString();
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
