package com.inboxflow.service.flow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.exception.FlowDefinitionException;
import com.inboxflow.model.Flow;
import com.inboxflow.model.flow.ActionNode;
import com.inboxflow.model.flow.ConditionNode;
import com.inboxflow.model.flow.ConditionOperator;
import com.inboxflow.model.flow.DelayNode;
import com.inboxflow.model.flow.FlowButton;
import com.inboxflow.model.flow.FlowEdge;
import com.inboxflow.model.flow.FlowGraph;
import com.inboxflow.model.flow.FlowNode;
import com.inboxflow.model.flow.MessageNode;
import com.inboxflow.model.flow.NodeType;
import com.inboxflow.model.flow.StartNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a validated {@link FlowGraph} from the JSON the flow builder saves.
 *
 * Node JSON:  {"id":"m1","type":"message","data":{"content":"Hi","buttons":[{"id":"yes","label":"Yes"}]}}
 * Edge JSON:  {"id":"e1","source":"c1","target":"m1","sourceHandle":"true"}
 *
 * Per-type data:
 *   start     → (none)
 *   message   → content, buttons[{id?, label}] (at most 3; id defaults to "btn-{index}")
 *   condition → field, operator (equals, contains, starts_with, ends_with, greater_than, less_than), value
 *   delay     → delayMs (defaults to 1000)
 *   action    → actionType
 *
 * Anything malformed raises {@link FlowDefinitionException}: such a flow must
 * fail loudly, never half-run.
 */
@Component
@RequiredArgsConstructor
public class FlowDefinitionParser {

    static final long DEFAULT_DELAY_MS = 1000;

    private final ObjectMapper objectMapper;

    public FlowGraph parse(Flow flow) {
        return parse(readJson(flow.getNodes(), "nodes"), readJson(flow.getEdges(), "edges"));
    }

    /** Same as {@link #parse(JsonNode, JsonNode)}, and additionally requires a Start node. */
    public FlowGraph parseRunnable(JsonNode nodes, JsonNode edges) {
        FlowGraph graph = parse(nodes, edges);
        if (graph.startNode().isEmpty()) {
            throw new FlowDefinitionException("Flow has no start node");
        }
        return graph;
    }

    public FlowGraph parse(JsonNode nodes, JsonNode edges) {
        if (nodes == null || !nodes.isArray()) {
            throw new FlowDefinitionException("Flow nodes must be a JSON array");
        }
        if (edges == null || edges.isNull()) {
            edges = objectMapper.createArrayNode();
        }
        if (!edges.isArray()) {
            throw new FlowDefinitionException("Flow edges must be a JSON array");
        }

        List<FlowNode> parsedNodes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (JsonNode node : nodes) {
            FlowNode parsed = parseNode(node);
            if (!ids.add(parsed.getId())) {
                throw new FlowDefinitionException("Duplicate node id: " + parsed.getId());
            }
            parsedNodes.add(parsed);
        }

        Map<String, FlowNode> byId = parsedNodes.stream()
                .collect(Collectors.toMap(FlowNode::getId, Function.identity()));

        List<FlowEdge> parsedEdges = new ArrayList<>();
        int index = 0;
        for (JsonNode edge : edges) {
            parsedEdges.add(parseEdge(edge, index++, byId));
        }

        return new FlowGraph(parsedNodes, parsedEdges);
    }

    private FlowNode parseNode(JsonNode node) {
        String id = requiredText(node, "id", "Node without id");
        String rawType = node.path("type").asText(null);
        NodeType type = NodeType.fromValue(rawType)
                .orElseThrow(() -> new FlowDefinitionException("Node " + id + " has unknown type: " + rawType));
        JsonNode data = node.path("data");

        return switch (type) {
            case START -> new StartNode(id);
            case MESSAGE -> parseMessage(id, data);
            case CONDITION -> parseCondition(id, data);
            case DELAY -> new DelayNode(id, data.path("delayMs").asLong(DEFAULT_DELAY_MS));
            case ACTION -> new ActionNode(id, data.path("actionType").asText(null));
        };
    }

    private MessageNode parseMessage(String id, JsonNode data) {
        JsonNode rawButtons = data.path("buttons");
        List<FlowButton> buttons = new ArrayList<>();
        if (rawButtons.isArray()) {
            if (rawButtons.size() > MessageNode.MAX_BUTTONS) {
                throw new FlowDefinitionException("Message node " + id + " has " + rawButtons.size()
                        + " buttons; at most " + MessageNode.MAX_BUTTONS + " are allowed");
            }
            int index = 0;
            for (JsonNode button : rawButtons) {
                String buttonId = button.path("id").asText("");
                String label = button.path("label").asText("");
                if (label.isBlank()) {
                    throw new FlowDefinitionException("Button " + index + " of message node " + id + " has no label");
                }
                buttons.add(new FlowButton(buttonId.isBlank() ? "btn-" + index : buttonId, label));
                index++;
            }
        }
        String content = data.path("content").asText(null);
        return new MessageNode(id, content, buttons);
    }

    private ConditionNode parseCondition(String id, JsonNode data) {
        String field = requiredText(data, "field", "Condition node " + id + " has no field");
        String rawOperator = requiredText(data, "operator", "Condition node " + id + " has no operator");
        ConditionOperator operator = ConditionOperator.fromValue(rawOperator)
                .orElseThrow(() -> new FlowDefinitionException(
                        "Condition node " + id + " has unknown operator: " + rawOperator));
        return new ConditionNode(id, field, operator, data.path("value").asText(""));
    }

    private FlowEdge parseEdge(JsonNode edge, int index, Map<String, FlowNode> nodes) {
        String source = requiredText(edge, "source", "Edge " + index + " has no source");
        String target = requiredText(edge, "target", "Edge " + index + " has no target");
        if (!nodes.containsKey(source)) {
            throw new FlowDefinitionException("Edge " + index + " starts at unknown node: " + source);
        }
        if (!nodes.containsKey(target)) {
            throw new FlowDefinitionException("Edge " + index + " points to unknown node: " + target);
        }

        String handle = edge.path("sourceHandle").asText("");
        String sourceHandle = handle.isBlank() ? null : handle;

        if (nodes.get(source).getType() == NodeType.CONDITION
                && !ConditionNode.TRUE_HANDLE.equals(sourceHandle)
                && !ConditionNode.FALSE_HANDLE.equals(sourceHandle)) {
            throw new FlowDefinitionException("Edge " + index + " leaves condition node " + source
                    + " without a true/false handle");
        }

        String id = edge.path("id").asText("");
        return new FlowEdge(id.isBlank() ? "edge-" + index : id, source, target, sourceHandle);
    }

    private JsonNode readJson(String json, String what) {
        try {
            return objectMapper.readTree(json == null ? "[]" : json);
        } catch (JsonProcessingException e) {
            throw new FlowDefinitionException("Flow " + what + " are not valid JSON", e);
        }
    }

    private static String requiredText(JsonNode node, String field, String error) {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new FlowDefinitionException(error);
        }
        return value;
    }
}
