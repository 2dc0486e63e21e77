package xyz.vvrf.reactor.agent.registry;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.test.util.TestAgentNode;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimpleNodeRegistryTest {

    private final SimpleNodeRegistry<String> registry = new SimpleNodeRegistry<>(String.class);

    @Test
    void register_prototypeIsReturnedAsIs() {
        TestAgentNode<String> node = TestAgentNode.<String>builder("echo").executionTimeout(Duration.ofSeconds(7)).build();

        registry.register("echo", node);

        assertSame(node, registry.getNodeInstance("echo").get());
        NodeRegistry.NodeMetadata metadata = registry.getNodeMetadata("echo").get();
        assertEquals("echo", metadata.getTypeId());
        assertEquals(TestAgentNode.class, metadata.getImplementationType());
        assertEquals(Duration.ofSeconds(7), metadata.getDeclaredTimeout());
    }

    @Test
    void register_factoryCreatesFreshInstances() {
        AtomicInteger created = new AtomicInteger();
        registry.register("fresh", () -> {
            created.incrementAndGet();
            return TestAgentNode.<String>builder("fresh").build();
        });

        AgentNode<String> first = registry.getNodeInstance("fresh").get();
        AgentNode<String> second = registry.getNodeInstance("fresh").get();

        assertNotSame(first, second);
        // 注册时创建一次用于提取元数据
        assertEquals(3, created.get());
    }

    @Test
    void register_rejectsDuplicateIds() {
        registry.register("dup", TestAgentNode.<String>builder("dup").build());

        assertThrows(IllegalArgumentException.class,
                () -> registry.register("dup", TestAgentNode.<String>builder("dup").build()));
        assertEquals(1, registry.getAllNodeMetadata().size());
    }

    @Test
    void register_failingFactoryIsRolledBack() {
        assertThrows(IllegalArgumentException.class, () -> registry.register("bad", () -> {
            throw new IllegalStateException("cannot build");
        }));
        assertThrows(IllegalArgumentException.class, () -> registry.register("nullNode", () -> null));

        assertFalse(registry.getNodeInstance("bad").isPresent());
        assertFalse(registry.getNodeMetadata("nullNode").isPresent());
    }

    @Test
    void getNodeInstance_unknownTypeIsEmpty() {
        assertFalse(registry.getNodeInstance("nope").isPresent());
        assertEquals(String.class, registry.getStateType());
    }
}
