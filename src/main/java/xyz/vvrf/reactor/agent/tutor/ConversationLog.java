package xyz.vvrf.reactor.agent.tutor;

import xyz.vvrf.reactor.agent.provider.ChatMessage;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 只追加的对话记录。每条消息在追加时获得一个稳定的下标，之后不会改变。
 * 节点通过下标区间读取切片，切片是视图，不复制底层记录。
 *
 * @author ruifeng.wen
 */
public final class ConversationLog {

    private final List<ChatMessage> entries = new ArrayList<>();

    public ConversationLog() {
    }

    public ConversationLog(List<ChatMessage> history) {
        if (history != null) {
            for (ChatMessage message : history) {
                append(message);
            }
        }
    }

    /**
     * @return 新消息的下标
     */
    public synchronized int append(ChatMessage message) {
        entries.add(Objects.requireNonNull(message, "消息不能为空"));
        return entries.size() - 1;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized ChatMessage get(int index) {
        return entries.get(index);
    }

    /**
     * 下标区间 [from, to) 的只读视图。
     */
    public List<ChatMessage> slice(int from, int to) {
        synchronized (this) {
            if (from < 0 || to > entries.size() || from > to) {
                throw new IndexOutOfBoundsException("切片越界: [" + from + ", " + to + "), size=" + entries.size());
            }
        }
        return new Slice(from, to);
    }

    /**
     * 截止到 {@code end} (不含) 的最后 {@code limit} 条消息。
     */
    public List<ChatMessage> window(int end, int limit) {
        int to = Math.min(end, size());
        return slice(Math.max(0, to - limit), to);
    }

    private final class Slice extends AbstractList<ChatMessage> {
        private final int from;
        private final int to;

        private Slice(int from, int to) {
            this.from = from;
            this.to = to;
        }

        @Override
        public ChatMessage get(int index) {
            if (index < 0 || index >= size()) {
                throw new IndexOutOfBoundsException("下标: " + index + ", 切片大小: " + size());
            }
            return ConversationLog.this.get(from + index);
        }

        @Override
        public int size() {
            return to - from;
        }
    }
}
