package xyz.vvrf.reactor.agent.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeDefinition;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.exception.NodeExecutionException;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;
import xyz.vvrf.reactor.agent.registry.NodeRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * NodeExecutor 的标准实现。
 * 获取节点实现，应用超时 (考虑实例覆盖)，在节点调度器上执行节点逻辑，并通知监听器。
 * 节点不会被重试。
 *
 * @param <S> 状态类型。
 * @author ruifeng.wen
 */
@Slf4j
public class StandardNodeExecutor<S> implements NodeExecutor<S> {

    private final NodeRegistry<S> nodeRegistry;
    private final Duration defaultNodeTimeout;
    private final Scheduler nodeExecutionScheduler;
    private final List<AgentMonitorListener> monitorListeners;

    public StandardNodeExecutor(NodeRegistry<S> nodeRegistry,
                                Duration defaultNodeTimeout,
                                Scheduler nodeExecutionScheduler,
                                List<AgentMonitorListener> monitorListeners) {
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "NodeRegistry 不能为空");
        this.defaultNodeTimeout = Objects.requireNonNull(defaultNodeTimeout, "默认节点超时不能为空");
        this.nodeExecutionScheduler = Objects.requireNonNull(nodeExecutionScheduler, "节点执行调度器不能为空");
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("为状态 '{}' 初始化了 StandardNodeExecutor。默认超时: {}, 调度器: {}, 监听器数量: {}",
                nodeRegistry.getStateType().getSimpleName(),
                defaultNodeTimeout,
                nodeExecutionScheduler.getClass().getSimpleName(),
                this.monitorListeners.size());
    }

    @Override
    public Mono<NodeResult<S>> executeNode(NodeDefinition nodeDefinition, S state, NodeContext context, String graphName) {
        final String instanceId = nodeDefinition.getInstanceId();
        final String nodeTypeId = nodeDefinition.getNodeTypeId();
        final String requestId = context.getRequestId();

        return Mono.defer(() -> {
            final AgentNode<S> node;
            try {
                node = nodeRegistry.getNodeInstance(nodeTypeId)
                        .orElseThrow(() -> new IllegalStateException(
                                String.format("在注册表中找不到类型 ID '%s' (状态: %s) 的节点实现",
                                        nodeTypeId, nodeRegistry.getStateType().getSimpleName())));
            } catch (Exception e) {
                log.error("[RequestId: {}][Graph: '{}'] 从注册表获取节点实例 '{}' (类型: {}) 失败。",
                        requestId, graphName, instanceId, nodeTypeId, e);
                safeNotifyListeners(l -> l.onNodeFailure(requestId, graphName, instanceId, Duration.ZERO, e, null));
                return Mono.error(new NodeExecutionException(instanceId, e));
            }

            final Duration timeout = determineEffectiveTimeout(nodeDefinition, node);
            final Instant startTime = Instant.now();
            safeNotifyListeners(l -> l.onNodeStart(requestId, graphName, instanceId, node));
            log.debug("[RequestId: {}][Graph: '{}'][Gen: {}] 执行节点 '{}' (类型: {}, 实现: {}, 超时: {})",
                    requestId, graphName, context.getGeneration(), instanceId, nodeTypeId,
                    node.getClass().getSimpleName(), timeout);

            return Mono.defer(() -> node.execute(state, context))
                    .subscribeOn(nodeExecutionScheduler)
                    .timeout(timeout)
                    .takeUntilOther(context.getCancellationToken().whenCancelled())
                    .doOnNext(result -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        log.debug("[RequestId: {}][Graph: '{}'] 节点 '{}' 成功。耗时: {}ms, 决策: {}",
                                requestId, graphName, instanceId, duration.toMillis(), result.getDecision());
                        safeNotifyListeners(l -> l.onNodeSuccess(requestId, graphName, instanceId, duration, result));
                    })
                    .doOnCancel(() -> log.debug("[RequestId: {}][Graph: '{}'] 节点 '{}' 的执行被取消订阅。",
                            requestId, graphName, instanceId))
                    .onErrorMap(error -> {
                        Duration duration = Duration.between(startTime, Instant.now());
                        if (error instanceof TimeoutException) {
                            log.warn("[RequestId: {}][Graph: '{}'] 节点 '{}' 执行超时 ({})。",
                                    requestId, graphName, instanceId, timeout);
                            safeNotifyListeners(l -> l.onNodeTimeout(requestId, graphName, instanceId, timeout, node));
                        } else {
                            log.error("[RequestId: {}][Graph: '{}'] 节点 '{}' 执行失败: {}",
                                    requestId, graphName, instanceId, error.getMessage());
                        }
                        safeNotifyListeners(l -> l.onNodeFailure(requestId, graphName, instanceId, duration, error, node));
                        if (error instanceof NodeExecutionException) {
                            return error;
                        }
                        if (error instanceof TimeoutException) {
                            return new NodeExecutionException(instanceId,
                                    new TimeoutException("执行超时 (" + timeout.toMillis() + "ms)"));
                        }
                        return new NodeExecutionException(instanceId, error);
                    });
        });
    }

    /**
     * 确定节点实例的有效超时时间。
     * 优先级：实例配置 -> 节点默认 -> 全局默认。
     */
    private Duration determineEffectiveTimeout(NodeDefinition nodeDefinition, AgentNode<?> node) {
        Duration instanceTimeout = nodeDefinition.getTimeoutOverride();
        if (isPositive(instanceTimeout)) {
            return instanceTimeout;
        }
        Duration nodeDefault = node.getExecutionTimeout();
        return isPositive(nodeDefault) ? nodeDefault : defaultNodeTimeout;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }

    private void safeNotifyListeners(Consumer<AgentMonitorListener> action) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (AgentMonitorListener listener : monitorListeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("调用监控监听器 {} 时出错: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
