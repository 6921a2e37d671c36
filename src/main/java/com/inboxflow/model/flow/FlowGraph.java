package com.inboxflow.model.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Validated, immutable view of a flow definition: nodes by id and outgoing
 * edges by source node, in the order they were declared.
 */
public class FlowGraph {

    private final Map<String, FlowNode> nodes;
    private final Map<String, List<FlowEdge>> outgoing;

    public FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {
        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            byId.put(node.getId(), node);
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.outgoing = edges.stream().collect(Collectors.groupingBy(
                FlowEdge::getSource, LinkedHashMap::new, Collectors.toUnmodifiableList()));
    }

    public Optional<FlowNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Optional<FlowNode> startNode() {
        return nodes.values().stream()
                .filter(n -> n.getType() == NodeType.START)
                .findFirst();
    }

    public List<FlowEdge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public int size() {
        return nodes.size();
    }
}
