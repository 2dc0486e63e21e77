package xyz.vvrf.reactor.agent.builder;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.RouteCondition;
import xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException;
import xyz.vvrf.reactor.agent.registry.SimpleNodeRegistry;
import xyz.vvrf.reactor.agent.test.util.TestAgentNode;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentGraphBuilderTest {

    private enum Verdict { YES, NO }

    private SimpleNodeRegistry<String> registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleNodeRegistry<>(String.class);
        registry.register("step", TestAgentNode.<String>builder("step").build());
    }

    @Test
    void build_validGraphKeepsDeclarationOrderAndRendersDot() {
        AgentGraph<String> graph = new AgentGraphBuilder<>("review", registry)
                .node("check", "step")
                .node("fix", "step", Duration.ofSeconds(3))
                .entry("check")
                .route("check")
                .onDecision(Verdict.NO, "fix")
                .otherwise(AgentGraph.TERMINAL)
                .route("fix").otherwise(AgentGraph.TERMINAL)
                .build();

        assertEquals("review", graph.getName());
        assertEquals("check", graph.getEntryNodeId());
        assertEquals(String.class, graph.getStateType());
        assertEquals(Duration.ofSeconds(3), graph.getNode("fix").get().getTimeoutOverride());
        assertEquals(2, graph.getRouteTable("check").get().getEdges().size());
        assertTrue(graph.getDotRepresentation().contains("\"check\" -> \"fix\" [label=\"1: NO\"]"));
        assertTrue(graph.getDotRepresentation().contains("\"check\" -> \"__end__\" [label=\"2: otherwise\", style=dashed]"));
    }

    @Test
    void build_allowsCycles() {
        AgentGraph<String> graph = new AgentGraphBuilder<>("loop", registry)
                .node("draft", "step")
                .node("critique", "step")
                .entry("draft")
                .route("draft").otherwise("critique")
                .route("critique")
                .when(RouteCondition.<String>onState(s -> s.length() < 10), "draft", "too short")
                .otherwise(AgentGraph.TERMINAL)
                .build();

        assertTrue(graph.getDotRepresentation().contains("too short"));
    }

    @Test
    void build_rejectsMissingEntry() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .route("a").otherwise(AgentGraph.TERMINAL);

        assertThrows(RouterMisconfigurationException.class, builder::build);
    }

    @Test
    void build_rejectsUndefinedEntry() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .entry("b")
                .route("a").otherwise(AgentGraph.TERMINAL);

        assertThrows(RouterMisconfigurationException.class, builder::build);
    }

    @Test
    void build_rejectsUnregisteredNodeType() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "missingType")
                .entry("a")
                .route("a").otherwise(AgentGraph.TERMINAL);

        RouterMisconfigurationException e = assertThrows(RouterMisconfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("missingType"));
    }

    @Test
    void build_rejectsEdgeToUnknownNode() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .entry("a")
                .route("a").onDecision(Verdict.YES, "ghost").otherwise(AgentGraph.TERMINAL);

        assertThrows(RouterMisconfigurationException.class, builder::build);
    }

    @Test
    void build_rejectsReachableNodeWithoutDefaultEdge() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .node("b", "step")
                .entry("a")
                .route("a").otherwise("b")
                .route("b").onDecision(Verdict.YES, AgentGraph.TERMINAL).end();

        RouterMisconfigurationException e = assertThrows(RouterMisconfigurationException.class, builder::build);
        assertTrue(e.getMessage().contains("'b'"));
    }

    @Test
    void build_toleratesUnreachableNodeWithoutRoutes() {
        AgentGraph<String> graph = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .node("orphan", "step")
                .entry("a")
                .route("a").otherwise(AgentGraph.TERMINAL)
                .build();

        assertTrue(graph.getNode("orphan").isPresent());
    }

    @Test
    void node_rejectsDuplicateAndReservedIds() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry).node("a", "step");

        assertThrows(IllegalArgumentException.class, () -> builder.node("a", "step"));
        assertThrows(IllegalArgumentException.class, () -> builder.node(AgentGraph.TERMINAL, "step"));
    }

    @Test
    void route_cannotBeDeclaredTwice() {
        AgentGraphBuilder<String> builder = new AgentGraphBuilder<>("g", registry)
                .node("a", "step")
                .route("a").otherwise(AgentGraph.TERMINAL);

        assertThrows(IllegalArgumentException.class, () -> builder.route("a"));
    }

    @Test
    void constructor_rejectsBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new AgentGraphBuilder<>(" ", registry));
    }
}
