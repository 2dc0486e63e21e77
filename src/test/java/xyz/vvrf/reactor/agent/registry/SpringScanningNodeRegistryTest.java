package xyz.vvrf.reactor.agent.registry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringScanningNodeRegistryTest {

    private AnnotationConfigApplicationContext context;

    @BeforeEach
    void setUp() {
        context = new AnnotationConfigApplicationContext();
        context.registerBean("greetingBean", GreetingNode.class);
        context.registerBean("unnamed", UnnamedNode.class);
        context.registerBean("counting", CountingNode.class);
        context.registerBean("notANode", NotANode.class);
        context.registerBean("registry", SpringScanningNodeRegistry.class,
                () -> new SpringScanningNodeRegistry<>(String.class));
        context.refresh();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void scan_registersMatchingStateTypeOnly() {
        SpringScanningNodeRegistry<String> registry = context.getBean(SpringScanningNodeRegistry.class);

        assertEquals(2, registry.getAllNodeMetadata().size());
        assertSame(context.getBean(GreetingNode.class), registry.getNodeInstance("greeting").get());
        assertFalse(registry.getNodeMetadata("counting").isPresent());
        assertFalse(registry.getNodeMetadata("notANode").isPresent());
    }

    @Test
    @SuppressWarnings("unchecked")
    void scan_fallsBackToBeanNameWithoutId() {
        SpringScanningNodeRegistry<String> registry = context.getBean(SpringScanningNodeRegistry.class);

        assertTrue(registry.getNodeInstance("unnamed").isPresent());
        assertEquals(UnnamedNode.class, registry.getNodeMetadata("unnamed").get().getImplementationType());
    }

    @AgentNodeType(id = "greeting", stateType = String.class)
    static class GreetingNode implements AgentNode<String> {
        @Override
        public Mono<NodeResult<String>> execute(String state, NodeContext context) {
            return Mono.just(NodeResult.of("hello " + state));
        }
    }

    @AgentNodeType(stateType = String.class)
    static class UnnamedNode implements AgentNode<String> {
        @Override
        public Mono<NodeResult<String>> execute(String state, NodeContext context) {
            return Mono.just(NodeResult.of(state));
        }
    }

    @AgentNodeType(id = "counting", stateType = Integer.class)
    static class CountingNode implements AgentNode<Integer> {
        @Override
        public Mono<NodeResult<Integer>> execute(Integer state, NodeContext context) {
            return Mono.just(NodeResult.of(state + 1));
        }
    }

    @AgentNodeType(id = "notANode", stateType = String.class)
    static class NotANode {
    }
}
