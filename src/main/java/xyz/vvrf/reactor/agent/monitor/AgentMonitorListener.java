package xyz.vvrf.reactor.agent.monitor;

import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.dispatch.ProviderCallAttempt;

import java.time.Duration;

/**
 * 用于监控运行、节点和提供方调用的监听器接口。
 * 监听器抛出的异常会被调用方捕获并记录，不会影响运行。
 *
 * @author ruifeng.wen
 */
public interface AgentMonitorListener {

    /**
     * 运行开始时调用。
     *
     * @param requestId  请求 ID
     * @param graphName  图名称
     * @param sessionId  会话 ID
     * @param generation 运行代数
     */
    default void onRunStart(String requestId, String graphName, String sessionId, long generation) {
    }

    /**
     * 运行进入终态时调用。
     *
     * @param totalDuration 运行总耗时
     * @param status        终态
     * @param error         ERRORED 时的错误，其余为 null
     */
    default void onRunComplete(String requestId, String graphName, String sessionId, long generation,
                               Duration totalDuration, RunStatus status, Throwable error) {
    }

    /**
     * 节点执行开始时调用。
     *
     * @param requestId 请求 ID
     * @param graphName 图名称
     * @param nodeId    节点实例 ID
     * @param node      节点实现
     */
    void onNodeStart(String requestId, String graphName, String nodeId, AgentNode<?> node);

    /**
     * 节点成功执行完成时调用。
     *
     * @param duration 节点执行耗时
     * @param result   节点结果
     */
    void onNodeSuccess(String requestId, String graphName, String nodeId, Duration duration, NodeResult<?> result);

    /**
     * 节点执行失败时调用。node 在注册表查找失败时可能为 null。
     */
    void onNodeFailure(String requestId, String graphName, String nodeId, Duration duration, Throwable error, AgentNode<?> node);

    /**
     * 节点执行超时时调用 (随后还会调用 onNodeFailure)。
     *
     * @param timeout 生效的超时配置
     */
    void onNodeTimeout(String requestId, String graphName, String nodeId, Duration timeout, AgentNode<?> node);

    /**
     * 每次提供方调用结束 (成功或失败) 时调用。
     */
    default void onProviderAttempt(ProviderCallAttempt attempt) {
    }
}
