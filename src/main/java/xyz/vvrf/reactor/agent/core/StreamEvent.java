package xyz.vvrf.reactor.agent.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 运行向客户端输出的事件。
 * 每个事件都带有所属运行的代数 (generation) 和运行内严格递增的序号 (sequence)。
 * DONE 事件是一次运行的最后一个事件，携带终态。
 *
 * @author ruifeng.wen
 */
@Getter
@EqualsAndHashCode
public final class StreamEvent {

    public enum Kind {
        FRAGMENT, ERROR, DONE
    }

    private final long generation;
    private final long sequence;
    private final Kind kind;
    private final String payload;
    private final RunStatus status;

    private StreamEvent(long generation, long sequence, Kind kind, String payload, RunStatus status) {
        this.generation = generation;
        this.sequence = sequence;
        this.kind = Objects.requireNonNull(kind, "事件类型不能为空");
        this.payload = payload;
        this.status = status;
    }

    public static StreamEvent fragment(long generation, long sequence, String text) {
        return new StreamEvent(generation, sequence, Kind.FRAGMENT, Objects.requireNonNull(text, "片段内容不能为空"), null);
    }

    public static StreamEvent error(long generation, long sequence, String message) {
        return new StreamEvent(generation, sequence, Kind.ERROR, message == null ? "未知错误" : message, null);
    }

    public static StreamEvent done(long generation, long sequence, RunStatus status) {
        Objects.requireNonNull(status, "终态不能为空");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("DONE 事件必须携带终态，实际为: " + status);
        }
        return new StreamEvent(generation, sequence, Kind.DONE, null, status);
    }

    public boolean isTerminal() {
        return kind == Kind.DONE;
    }

    @Override
    public String toString() {
        return "StreamEvent{gen=" + generation + ", seq=" + sequence + ", kind=" + kind +
                (status != null ? ", status=" + status : "") +
                (payload != null ? ", payload='" + payload + '\'' : "") + '}';
    }
}
