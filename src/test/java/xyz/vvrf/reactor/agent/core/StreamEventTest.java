package xyz.vvrf.reactor.agent.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamEventTest {

    @Test
    void done_requiresTerminalStatus() {
        assertThrows(IllegalArgumentException.class, () -> StreamEvent.done(1, 0, RunStatus.RUNNING));

        StreamEvent done = StreamEvent.done(1, 3, RunStatus.CANCELLED);
        assertTrue(done.isTerminal());
        assertEquals(RunStatus.CANCELLED, done.getStatus());
    }

    @Test
    void fragmentAndError_areNotTerminal() {
        assertFalse(StreamEvent.fragment(2, 0, "a").isTerminal());
        StreamEvent error = StreamEvent.error(2, 1, null);
        assertFalse(error.isTerminal());
        assertEquals("未知错误", error.getPayload());
    }

    @Test
    void runStatus_wireNamesAreLowercase() {
        assertEquals("completed", RunStatus.COMPLETED.wireName());
        assertEquals("errored", RunStatus.ERRORED.wireName());
        assertFalse(RunStatus.PENDING.isTerminal());
        assertTrue(RunStatus.CANCELLED.isTerminal());
    }
}
