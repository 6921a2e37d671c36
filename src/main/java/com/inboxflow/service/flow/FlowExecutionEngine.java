package com.inboxflow.service.flow;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.FlowDefinitionException;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.model.Flow;
import com.inboxflow.model.FlowExecution;
import com.inboxflow.model.flow.ActionNode;
import com.inboxflow.model.flow.ConditionNode;
import com.inboxflow.model.flow.DelayNode;
import com.inboxflow.model.flow.FlowButton;
import com.inboxflow.model.flow.FlowEdge;
import com.inboxflow.model.flow.FlowGraph;
import com.inboxflow.model.flow.FlowNode;
import com.inboxflow.model.flow.MessageNode;
import com.inboxflow.repository.FlowRepository;
import com.inboxflow.service.OutboundMessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Walks a flow graph for one claimed execution.
 *
 * FLOW:
 *   1. Load the flow and parse it into a typed graph
 *   2. Entry = currentNodeId (a resume) or the Start node
 *   3. Pop (node, context) off a work stack, run the node, push its successors
 *      in reverse so edges are visited in the order they were declared
 *
 * Per node:
 *   START     → all outgoing edges
 *   MESSAGE   → queue the message; with buttons the path stops and waits for a reply
 *   CONDITION → exactly the "true" or the "false" edge
 *   DELAY     → persist a continuation that wakes up later; the path stops
 *   ACTION    → logged, all outgoing edges
 *
 * On the resumed node itself the side effect is skipped: the message was already
 * sent and the delay has already elapsed. Only its outgoing edges are followed.
 *
 * A node with several outgoing edges (outside conditions) broadcasts to all of
 * them. Any path that keeps going beyond max-node-visits is treated as a cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FlowExecutionEngine {

    private final FlowRepository flowRepository;
    private final FlowDefinitionParser parser;
    private final ConditionEvaluator conditionEvaluator;
    private final OutboundMessageService outboundMessageService;
    private final FlowExecutionService flowExecutionService;
    private final InboxflowProperties properties;
    private final Clock clock;

    public void execute(FlowExecution execution) {
        Flow flow = flowRepository.findById(execution.getFlowId())
                .orElseThrow(() -> new MissingRecordException("Flow", execution.getFlowId()));
        FlowGraph graph = parser.parse(flow);

        boolean resuming = execution.getCurrentNodeId() != null;
        FlowNode entry = resuming
                ? graph.node(execution.getCurrentNodeId()).orElseThrow(() -> new FlowDefinitionException(
                        "Resume node " + execution.getCurrentNodeId() + " no longer exists in flow " + flow.getId()))
                : graph.startNode().orElseThrow(() -> new FlowDefinitionException(
                        "Flow " + flow.getId() + " has no start node"));

        log.info("Executing flow '{}' ({}) for {}: execution={}, entry={}{}",
                flow.getName(), flow.getId(), execution.getContactPhone(), execution.getId(),
                entry.getId(), resuming ? " (resume)" : "");

        ExecutionContext context = ExecutionContext.of(execution);
        Deque<Step> stack = new ArrayDeque<>();
        stack.push(new Step(entry, resuming));

        int maxVisits = properties.getFlows().getMaxNodeVisits();
        int visits = 0;
        while (!stack.isEmpty()) {
            Step step = stack.pop();
            if (++visits > maxVisits) {
                throw new FlowDefinitionException("Flow " + flow.getId() + " exceeded " + maxVisits
                        + " node visits in one run; the graph probably loops");
            }

            List<FlowNode> next = visit(graph, execution, context, step);
            for (int i = next.size() - 1; i >= 0; i--) {
                stack.push(new Step(next.get(i), false));
            }
        }
    }

    private List<FlowNode> visit(FlowGraph graph, FlowExecution execution, ExecutionContext context, Step step) {
        FlowNode node = step.node;
        log.debug("Visiting node {} ({}) of execution {}", node.getId(), node.getType(), execution.getId());

        return switch (node.getType()) {
            case START -> targets(graph, graph.outgoing(node.getId()));
            case MESSAGE -> visitMessage(graph, context, (MessageNode) node, step.resumed);
            case CONDITION -> visitCondition(graph, context, (ConditionNode) node);
            case DELAY -> visitDelay(graph, execution, context, (DelayNode) node, step.resumed);
            case ACTION -> {
                log.info("Action node {} ({}) reached; no side effect configured",
                        node.getId(), ((ActionNode) node).getKind());
                yield targets(graph, graph.outgoing(node.getId()));
            }
        };
    }

    private List<FlowNode> visitMessage(FlowGraph graph, ExecutionContext context, MessageNode node, boolean resumed) {
        List<FlowEdge> edges = graph.outgoing(node.getId());

        if (resumed) {
            if (!node.hasButtons()) {
                return targets(graph, edges);
            }
            return targets(graph, edgesForClick(node, edges, context.stateValue(FlowTriggerService.LAST_BUTTON_CLICK)));
        }

        outboundMessageService.queueFlowMessage(context, node);

        if (node.hasButtons()) {
            log.debug("Message node {} waits for a button reply", node.getId());
            return List.of();
        }
        return targets(graph, edges);
    }

    /**
     * Edges wired to the clicked button win; otherwise unlabeled edges act as a default.
     * The flow builder names button handles "button-{index}", so both that and the
     * button id are accepted.
     */
    List<FlowEdge> edgesForClick(MessageNode node, List<FlowEdge> edges, String clickedButtonId) {
        String indexHandle = null;
        List<FlowButton> buttons = node.getButtons();
        for (int i = 0; i < buttons.size(); i++) {
            if (buttons.get(i).getId().equals(clickedButtonId)) {
                indexHandle = "button-" + i;
                break;
            }
        }
        String byIndex = indexHandle;

        List<FlowEdge> clicked = edges.stream()
                .filter(e -> e.getSourceHandle() != null)
                .filter(e -> e.getSourceHandle().equals(clickedButtonId) || e.getSourceHandle().equals(byIndex))
                .collect(Collectors.toList());
        if (!clicked.isEmpty()) {
            return clicked;
        }
        return edges.stream()
                .filter(e -> e.getSourceHandle() == null)
                .collect(Collectors.toList());
    }

    private List<FlowNode> visitCondition(FlowGraph graph, ExecutionContext context, ConditionNode node) {
        boolean result = conditionEvaluator.evaluate(node, context.getVariables());
        String handle = result ? ConditionNode.TRUE_HANDLE : ConditionNode.FALSE_HANDLE;
        log.debug("Condition {} ({} {} '{}') → {}", node.getId(), node.getField(), node.getOperator(),
                node.getValue(), result);

        return graph.outgoing(node.getId()).stream()
                .filter(e -> handle.equals(e.getSourceHandle()))
                .findFirst()
                .map(e -> targets(graph, List.of(e)))
                .orElse(List.of());
    }

    private List<FlowNode> visitDelay(FlowGraph graph, FlowExecution execution, ExecutionContext context,
                                      DelayNode node, boolean resumed) {
        if (resumed) {
            return targets(graph, graph.outgoing(node.getId()));
        }
        long delayMs = clampDelay(node.getDelayMs());
        Instant wakeAt = clock.instant().plusMillis(delayMs);
        flowExecutionService.scheduleContinuation(execution, node.getId(), context.getState(), wakeAt);
        return List.of();
    }

    long clampDelay(long requestedMs) {
        InboxflowProperties.Flows flows = properties.getFlows();
        return Math.max(flows.getMinDelayMs(), Math.min(flows.getMaxDelayMs(), requestedMs));
    }

    private List<FlowNode> targets(FlowGraph graph, List<FlowEdge> edges) {
        // Edges were validated against the node set when the graph was parsed
        return edges.stream()
                .map(e -> graph.node(e.getTarget()).orElse(null))
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    private static final class Step {
        private final FlowNode node;
        private final boolean resumed;

        private Step(FlowNode node, boolean resumed) {
            this.node = node;
            this.resumed = resumed;
        }
    }
}
