package com.inboxflow.service.flow;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.FlowDefinitionException;
import com.inboxflow.exception.MissingRecordException;
import com.inboxflow.model.Flow;
import com.inboxflow.model.FlowExecution;
import com.inboxflow.model.FlowTriggerType;
import com.inboxflow.model.flow.FlowButton;
import com.inboxflow.model.flow.FlowEdge;
import com.inboxflow.model.flow.MessageNode;
import com.inboxflow.repository.FlowRepository;
import com.inboxflow.service.OutboundMessageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for FlowExecutionEngine, the graph interpreter.
 *
 * Parsing and condition evaluation are real; only persistence and outbound
 * sending are mocked, so each test reads as "given this graph, which
 * messages went out and what was scheduled".
 */
@ExtendWith(MockitoExtension.class)
class FlowExecutionEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @Mock private FlowRepository flowRepository;
    @Mock private OutboundMessageService outboundMessageService;
    @Mock private FlowExecutionService flowExecutionService;

    private InboxflowProperties properties;
    private FlowExecutionEngine engine;

    private final UUID flowId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        properties = new InboxflowProperties();
        engine = new FlowExecutionEngine(flowRepository, new FlowDefinitionParser(new ObjectMapper()),
                new ConditionEvaluator(), outboundMessageService, flowExecutionService, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private void givenFlow(String nodes, String edges) {
        Flow flow = Flow.builder()
                .id(flowId)
                .tenantId(UUID.randomUUID())
                .name("Test flow")
                .triggerType(FlowTriggerType.NEW_MESSAGE)
                .nodes(nodes.replace('\'', '"'))
                .edges(edges.replace('\'', '"'))
                .build();
        when(flowRepository.findById(flowId)).thenReturn(Optional.of(flow));
    }

    private FlowExecution execution(String messageBody) {
        return FlowExecution.builder()
                .id(UUID.randomUUID())
                .flowId(flowId)
                .tenantId(UUID.randomUUID())
                .contactPhone("+15551234567")
                .messageBody(messageBody)
                .triggeredBy(FlowTriggerType.NEW_MESSAGE)
                .build();
    }

    private List<String> sentNodeIds() {
        ArgumentCaptor<MessageNode> captor = ArgumentCaptor.forClass(MessageNode.class);
        verify(outboundMessageService, atLeast(0)).queueFlowMessage(any(ExecutionContext.class), captor.capture());
        return captor.getAllValues().stream().map(MessageNode::getId).collect(Collectors.toList());
    }

    private static String message(String id) {
        return "{'id':'" + id + "','type':'message','data':{'content':'" + id + "'}}";
    }

    @Test
    @DisplayName("Fan-out visits every branch once, in declaration order")
    void fanOutVisitsEachBranchOnce() {
        givenFlow("[{'id':'s','type':'start'}," + message("C") + "," + message("D") + "]",
                "[{'source':'s','target':'C'},{'source':'s','target':'D'}]");

        engine.execute(execution("hi"));

        assertEquals(List.of("C", "D"), sentNodeIds());
    }

    @Test
    @DisplayName("A condition follows exactly one branch")
    void conditionBranchesExclusively() {
        givenFlow("[{'id':'s','type':'start'},"
                        + "{'id':'c','type':'condition','data':{'field':'messageBody','operator':'contains','value':'price'}},"
                        + message("yes") + "," + message("no") + "]",
                "[{'source':'s','target':'c'},"
                        + "{'source':'c','target':'yes','sourceHandle':'true'},"
                        + "{'source':'c','target':'no','sourceHandle':'false'}]");

        engine.execute(execution("What is the PRICE?"));

        assertEquals(List.of("yes"), sentNodeIds());
    }

    @Test
    @DisplayName("A chain that fans out at its end sends every message once: A, B, then C and D")
    void chainThenFanOut() {
        givenFlow("[{'id':'s','type':'start'}," + message("A") + "," + message("B") + ","
                        + message("C") + "," + message("D") + "]",
                "[{'source':'s','target':'A'},{'source':'A','target':'B'},"
                        + "{'source':'B','target':'C'},{'source':'B','target':'D'}]");

        engine.execute(execution("hi"));

        assertEquals(List.of("A", "B", "C", "D"), sentNodeIds());
        verify(outboundMessageService, times(4)).queueFlowMessage(any(ExecutionContext.class), any(MessageNode.class));
    }

    @Test
    @DisplayName("A false condition takes only the false branch when both are wired")
    void conditionFalseBranchExclusively() {
        givenFlow("[{'id':'s','type':'start'},"
                        + "{'id':'c','type':'condition','data':{'field':'messageBody','operator':'contains','value':'price'}},"
                        + message("yes") + "," + message("no") + "]",
                "[{'source':'s','target':'c'},"
                        + "{'source':'c','target':'yes','sourceHandle':'true'},"
                        + "{'source':'c','target':'no','sourceHandle':'false'}]");

        engine.execute(execution("Where is my order?"));

        assertEquals(List.of("no"), sentNodeIds());
    }

    @Test
    @DisplayName("A condition with no edge for its result ends that path")
    void conditionWithoutMatchingEdge() {
        givenFlow("[{'id':'s','type':'start'},"
                        + "{'id':'c','type':'condition','data':{'field':'messageBody','operator':'equals','value':'x'}},"
                        + message("yes") + "]",
                "[{'source':'s','target':'c'},{'source':'c','target':'yes','sourceHandle':'true'}]");

        engine.execute(execution("y"));

        assertTrue(sentNodeIds().isEmpty());
    }

    @Test
    @DisplayName("A flow that loops forever fails instead of spinning")
    void cycleGuard() {
        properties.getFlows().setMaxNodeVisits(20);
        givenFlow("[{'id':'s','type':'start'},{'id':'a','type':'action'},{'id':'b','type':'action'}]",
                "[{'source':'s','target':'a'},{'source':'a','target':'b'},{'source':'b','target':'a'}]");

        assertThrows(FlowDefinitionException.class, () -> engine.execute(execution("hi")));
    }

    @Test
    @DisplayName("A deleted flow is a missing record")
    void missingFlow() {
        when(flowRepository.findById(flowId)).thenReturn(Optional.empty());

        assertThrows(MissingRecordException.class, () -> engine.execute(execution("hi")));
    }

    @Nested
    @DisplayName("Buttons")
    class Buttons {

        private static final String BUTTON_NODES = "[{'id':'s','type':'start'},"
                + "{'id':'q','type':'message','data':{'content':'Pick','buttons':[{'id':'yes','label':'Yes'},{'id':'no','label':'No'}]}},"
                + "{'id':'Y','type':'message','data':{'content':'Y'}},"
                + "{'id':'N','type':'message','data':{'content':'N'}}]";

        @Test
        @DisplayName("A message with buttons is sent and the path waits")
        void buttonsSuspendPath() {
            givenFlow(BUTTON_NODES, "[{'source':'s','target':'q'},{'source':'q','target':'Y','sourceHandle':'yes'}]");

            engine.execute(execution("hi"));

            assertEquals(List.of("q"), sentNodeIds());
        }

        @Test
        @DisplayName("Resuming after a click follows the edge wired to that button id")
        void resumeByButtonId() {
            givenFlow(BUTTON_NODES, "[{'source':'s','target':'q'},"
                    + "{'source':'q','target':'Y','sourceHandle':'yes'},"
                    + "{'source':'q','target':'N','sourceHandle':'no'}]");
            FlowExecution resumed = execution("No");
            resumed.setCurrentNodeId("q");
            resumed.setExecutionState(new LinkedHashMap<>(Map.of(FlowTriggerService.LAST_BUTTON_CLICK, "no")));

            engine.execute(resumed);

            assertEquals(List.of("N"), sentNodeIds());
        }

        @Test
        @DisplayName("Builder handles named button-{index} are matched too")
        void resumeByButtonIndex() {
            givenFlow(BUTTON_NODES, "[{'source':'s','target':'q'},"
                    + "{'source':'q','target':'Y','sourceHandle':'button-0'},"
                    + "{'source':'q','target':'N','sourceHandle':'button-1'}]");
            FlowExecution resumed = execution("Yes");
            resumed.setCurrentNodeId("q");
            resumed.setExecutionState(new LinkedHashMap<>(Map.of(FlowTriggerService.LAST_BUTTON_CLICK, "yes")));

            engine.execute(resumed);

            assertEquals(List.of("Y"), sentNodeIds());
        }

        @Test
        @DisplayName("Unlabeled edges are the fallback when no edge names the button")
        void unlabeledFallback() {
            MessageNode node = new MessageNode("q", "Pick", List.of(new FlowButton("yes", "Yes")));
            List<FlowEdge> edges = List.of(
                    new FlowEdge("e1", "q", "X", "other"),
                    new FlowEdge("e2", "q", "Y", null));

            List<FlowEdge> chosen = engine.edgesForClick(node, edges, "yes");

            assertEquals(1, chosen.size());
            assertEquals("e2", chosen.get(0).getId());
        }
    }

    @Nested
    @DisplayName("Delays")
    class Delays {

        private static final String DELAY_NODES = "[{'id':'s','type':'start'},"
                + "{'id':'d','type':'delay','data':{'delayMs':5000}},"
                + "{'id':'after','type':'message','data':{'content':'later'}}]";
        private static final String DELAY_EDGES = "[{'source':'s','target':'d'},{'source':'d','target':'after'}]";

        @Test
        @DisplayName("A delay persists a continuation and stops the path")
        void delaySchedulesContinuation() {
            givenFlow(DELAY_NODES, DELAY_EDGES);
            FlowExecution execution = execution("hi");

            engine.execute(execution);

            verify(flowExecutionService).scheduleContinuation(eq(execution), eq("d"), anyMap(),
                    eq(NOW.plusMillis(5000)));
            assertTrue(sentNodeIds().isEmpty());
        }

        @Test
        @DisplayName("The continuation skips the wait and carries on")
        void continuationResumesAfterDelay() {
            givenFlow(DELAY_NODES, DELAY_EDGES);
            FlowExecution continuation = execution("hi");
            continuation.setCurrentNodeId("d");

            engine.execute(continuation);

            verify(flowExecutionService, never()).scheduleContinuation(any(), any(), any(), any());
            assertEquals(List.of("after"), sentNodeIds());
        }

        @Test
        @DisplayName("Requested delays are clamped to the configured window")
        void clampDelay() {
            assertEquals(1000, engine.clampDelay(10));
            assertEquals(300_000, engine.clampDelay(86_400_000));
            assertEquals(42_000, engine.clampDelay(42_000));
        }
    }
}
