package xyz.vvrf.reactor.agent.execution;

import lombok.Getter;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.core.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 一次图执行的句柄，管理其状态机、序号、步数和节点日志。
 * 每次 {@link AgentEngine#execute} 调用对应一个实例，不可复用。
 *
 * @author ruifeng.wen
 */
@Getter
public class AgentRun {

    private final String sessionId;
    private final long generation;
    private final String requestId;
    private final CancellationToken token;
    private final Instant createdAt = Instant.now();

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.PENDING);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong sequence = new AtomicLong(0);
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger steps = new AtomicInteger(0);
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> nodeLog = new CopyOnWriteArrayList<>();

    private volatile String currentNodeId;

    public AgentRun(String sessionId, long generation, String requestId, CancellationToken token) {
        this.sessionId = Objects.requireNonNull(sessionId, "会话 ID 不能为空");
        this.generation = generation;
        this.requestId = (requestId == null || requestId.isEmpty()) ? UUID.randomUUID().toString() : requestId;
        this.token = Objects.requireNonNull(token, "取消令牌不能为空");
    }

    public RunStatus getStatus() {
        return status.get();
    }

    /**
     * PENDING -> RUNNING。
     *
     * @return 状态转换是否成功
     */
    boolean start() {
        return status.compareAndSet(RunStatus.PENDING, RunStatus.RUNNING);
    }

    /**
     * 进入终态。终态是吸收态，已经结束的运行返回 false。
     */
    boolean finish(RunStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("不是终态: " + terminal);
        }
        while (true) {
            RunStatus current = status.get();
            if (current.isTerminal()) {
                return false;
            }
            if (status.compareAndSet(current, terminal)) {
                return true;
            }
        }
    }

    long nextSequence() {
        return sequence.getAndIncrement();
    }

    int incrementSteps() {
        return steps.incrementAndGet();
    }

    public int getStepCount() {
        return steps.get();
    }

    void setCurrentNodeId(String nodeId) {
        this.currentNodeId = nodeId;
    }

    void recordCompletedNode(String nodeId) {
        nodeLog.add(nodeId);
    }

    /**
     * 已完成节点的有序快照。
     */
    public List<String> getNodeLog() {
        return Collections.unmodifiableList(new ArrayList<>(nodeLog));
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }

    /**
     * 请求取消。运行在下一个检查点 (节点边界或挂起的提供方调用) 结束。
     */
    public boolean cancel() {
        return token.cancel();
    }

    @Override
    public String toString() {
        return "AgentRun{session=" + sessionId + ", gen=" + generation + ", requestId=" + requestId +
                ", status=" + status.get() + ", node=" + currentNodeId + '}';
    }
}
