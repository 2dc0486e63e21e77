package xyz.vvrf.reactor.agent.checkpoint;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CaffeineCheckpointStoreTest {

    private final CaffeineCheckpointStore<String> store = new CaffeineCheckpointStore<>(Duration.ofMinutes(5), 100);

    @Test
    void save_newerGenerationReplacesOlder() {
        assertTrue(store.save(checkpoint("s1", 1, "first")));
        assertTrue(store.save(checkpoint("s1", 2, "second")));

        assertEquals("second", store.load("s1").get().getState());
    }

    @Test
    void save_olderGenerationIsIgnored() {
        store.save(checkpoint("s1", 3, "current"));

        assertFalse(store.save(checkpoint("s1", 2, "stale")));
        assertEquals(3L, store.load("s1").get().getGeneration());
    }

    @Test
    void save_sameGenerationOverwrites() {
        store.save(checkpoint("s1", 1, "after analyze"));
        store.save(checkpoint("s1", 1, "after plan"));

        assertEquals("after plan", store.load("s1").get().getState());
    }

    @Test
    void discard_onlyRemovesMatchingGeneration() {
        store.save(checkpoint("s1", 2, "live"));

        store.discard("s1", 1);
        assertTrue(store.load("s1").isPresent());

        store.discard("s1", 2);
        assertFalse(store.load("s1").isPresent());
    }

    @Test
    void clear_removesSessionOnly() {
        store.save(checkpoint("s1", 1, "a"));
        store.save(checkpoint("s2", 1, "b"));

        store.clear("s1");

        assertFalse(store.load("s1").isPresent());
        assertTrue(store.load("s2").isPresent());
    }

    private static RunCheckpoint<String> checkpoint(String sessionId, long generation, String state) {
        return RunCheckpoint.<String>builder()
                .sessionId(sessionId)
                .generation(generation)
                .requestId("req-" + generation)
                .lastNodeId("analyze")
                .nextNodeId("plan")
                .state(state)
                .completedNode("analyze")
                .savedAt(Instant.now())
                .build();
    }
}
