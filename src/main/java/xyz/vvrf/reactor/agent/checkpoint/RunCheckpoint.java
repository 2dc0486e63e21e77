package xyz.vvrf.reactor.agent.checkpoint;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 每个节点完成后保存的运行快照。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Value
@Builder
public class RunCheckpoint<S> {

    String sessionId;
    long generation;
    String requestId;
    String lastNodeId;
    /**
     * 下一个要执行的节点，运行结束时为 TERMINAL。
     */
    String nextNodeId;
    S state;
    @Singular("completedNode")
    List<String> nodeLog;
    Instant savedAt;
}
