package xyz.vvrf.reactor.agent.session;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.reactor.agent.core.RunStatus;

import java.time.Instant;
import java.util.List;

/**
 * 会话的只读诊断视图。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class SessionSnapshot {

    String sessionId;
    long generation;
    /**
     * 当前代数的运行状态，尚未关联运行时为 null。
     */
    RunStatus runStatus;
    String currentNodeId;
    /**
     * 当前运行已执行的节点步数。
     */
    int stepCount;
    List<String> nodeLog;
    Instant lastAdmittedAt;
}
