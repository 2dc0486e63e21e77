package xyz.vvrf.reactor.agent.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.dispatch.AttemptOutcome;
import xyz.vvrf.reactor.agent.dispatch.ProviderCallAttempt;

import java.time.Duration;

@Slf4j
public class LoggingAgentMonitorListener implements AgentMonitorListener {

    @Override
    public void onRunStart(String requestId, String graphName, String sessionId, long generation) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 会话:[{}] 代数:[{}] 运行开始。",
                requestId, graphName, sessionId, generation);
    }

    @Override
    public void onRunComplete(String requestId, String graphName, String sessionId, long generation,
                              Duration totalDuration, RunStatus status, Throwable error) {
        if (status == RunStatus.ERRORED) {
            log.error("[MONITOR] 请求:[{}] 图:[{}] 会话:[{}] 代数:[{}] 运行失败。 耗时:[{}ms], 错误:[{}]",
                    requestId, graphName, sessionId, generation, totalDuration.toMillis(),
                    error != null ? error.getMessage() : "未知");
        } else {
            log.info("[MONITOR] 请求:[{}] 图:[{}] 会话:[{}] 代数:[{}] 运行结束。 状态:[{}], 耗时:[{}ms]",
                    requestId, graphName, sessionId, generation, status, totalDuration.toMillis());
        }
    }

    @Override
    public void onNodeStart(String requestId, String graphName, String nodeId, AgentNode<?> node) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 开始。 类:[{}]",
                requestId, graphName, nodeId, node.getClass().getSimpleName());
    }

    @Override
    public void onNodeSuccess(String requestId, String graphName, String nodeId, Duration duration, NodeResult<?> result) {
        log.info("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 成功。 耗时:[{}ms], 决策:[{}]",
                requestId, graphName, nodeId, duration.toMillis(), result.getDecision());
    }

    @Override
    public void onNodeFailure(String requestId, String graphName, String nodeId, Duration duration, Throwable error, AgentNode<?> node) {
        log.error("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 失败。 耗时:[{}ms], 错误:[{}], 类:[{}]",
                requestId, graphName, nodeId, duration.toMillis(), error.getMessage(),
                node != null ? node.getClass().getSimpleName() : "N/A");
    }

    @Override
    public void onNodeTimeout(String requestId, String graphName, String nodeId, Duration timeout, AgentNode<?> node) {
        log.warn("[MONITOR] 请求:[{}] 图:[{}] 节点:[{}] 超时。 配置:[{}ms], 类:[{}]",
                requestId, graphName, nodeId, timeout.toMillis(), node.getClass().getSimpleName());
    }

    @Override
    public void onProviderAttempt(ProviderCallAttempt attempt) {
        if (attempt.getOutcome() == AttemptOutcome.SUCCESS) {
            log.debug("[MONITOR] 提供方:[{}] 能力:[{}] 第 {} 次尝试成功。 耗时:[{}ms]",
                    attempt.getProviderName(), attempt.getCapability(), attempt.getAttemptNumber(), attempt.getLatency().toMillis());
        } else {
            log.warn("[MONITOR] 提供方:[{}] 能力:[{}] 第 {} 次尝试失败。 结果:[{}], 退避:[{}ms], 错误:[{}]",
                    attempt.getProviderName(), attempt.getCapability(), attempt.getAttemptNumber(), attempt.getOutcome(),
                    attempt.getBackoffDelay().toMillis(), attempt.getErrorMessage());
        }
    }
}
