package xyz.vvrf.reactor.agent.tutor;

import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.agent.provider.ChatMessage;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConversationLogTest {

    @Test
    void append_returnsStableIndexes() {
        ConversationLog log = new ConversationLog();

        assertEquals(0, log.append(ChatMessage.user("hi")));
        assertEquals(1, log.append(ChatMessage.assistant("hello")));
        assertEquals(2, log.size());
        assertEquals("hello", log.get(1).getContent());
    }

    @Test
    void slice_isViewOfRange() {
        ConversationLog log = new ConversationLog(Arrays.asList(
                ChatMessage.user("q1"), ChatMessage.assistant("a1"), ChatMessage.user("q2")));

        List<ChatMessage> slice = log.slice(1, 3);
        log.append(ChatMessage.assistant("a2"));

        assertEquals(2, slice.size());
        assertEquals("a1", slice.get(0).getContent());
        assertEquals("q2", slice.get(1).getContent());
        assertThrows(IndexOutOfBoundsException.class, () -> slice.get(2));
        assertThrows(UnsupportedOperationException.class, () -> slice.add(ChatMessage.user("x")));
    }

    @Test
    void slice_rejectsOutOfRange() {
        ConversationLog log = new ConversationLog();
        log.append(ChatMessage.user("only"));

        assertThrows(IndexOutOfBoundsException.class, () -> log.slice(0, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> log.slice(1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> log.slice(-1, 1));
    }

    @Test
    void window_returnsLastMessagesBeforeEnd() {
        ConversationLog log = new ConversationLog();
        for (int i = 0; i < 10; i++) {
            log.append(ChatMessage.user("m" + i));
        }

        List<ChatMessage> window = log.window(8, 3);

        assertEquals(3, window.size());
        assertEquals("m5", window.get(0).getContent());
        assertEquals("m7", window.get(2).getContent());
        assertEquals(10, log.window(100, 20).size());
        assertEquals(0, log.window(0, 5).size());
    }

    @Test
    void constructor_toleratesNullHistory() {
        assertEquals(0, new ConversationLog(null).size());
    }
}
