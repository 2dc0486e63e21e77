package xyz.vvrf.reactor.agent.execution;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.checkpoint.CheckpointStore;
import xyz.vvrf.reactor.agent.checkpoint.RunCheckpoint;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeDefinition;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.core.Router;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.core.StreamEvent;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;
import xyz.vvrf.reactor.agent.exception.NodeExecutionException;
import xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException;
import xyz.vvrf.reactor.agent.exception.StepLimitExceededException;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * AgentEngine 的标准实现。
 * <p>
 * 每次运行是一个顺序循环：检查取消 -> 执行节点 (片段立即转发) -> 路由 -> 保存检查点 -> 继续。
 * 路由到 TERMINAL 时以 COMPLETED 结束；节点或路由出错时先发出一个 ERROR 事件，再以 ERRORED 结束；
 * 取消令牌被触发后，在下一个检查点以 CANCELLED 结束并丢弃该代数的检查点。运行级别不重试。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Slf4j
public class StandardAgentEngine<S> implements AgentEngine<S> {

    private final NodeExecutor<S> nodeExecutor;
    private final ProviderDispatcher dispatcher;
    private final CheckpointStore<S> checkpointStore;
    private final int maxSteps;
    private final List<AgentMonitorListener> monitorListeners;

    public StandardAgentEngine(NodeExecutor<S> nodeExecutor,
                               ProviderDispatcher dispatcher,
                               CheckpointStore<S> checkpointStore,
                               int maxSteps,
                               List<AgentMonitorListener> monitorListeners) {
        this.nodeExecutor = Objects.requireNonNull(nodeExecutor, "NodeExecutor 不能为空");
        this.dispatcher = Objects.requireNonNull(dispatcher, "ProviderDispatcher 不能为空");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "CheckpointStore 不能为空");
        if (maxSteps <= 0) {
            throw new IllegalArgumentException("最大步数必须为正数");
        }
        this.maxSteps = maxSteps;
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("StandardAgentEngine 已初始化。Executor: {}, 最大步数: {}, 检查点存储: {}, 监听器数量: {}",
                nodeExecutor.getClass().getSimpleName(), maxSteps,
                checkpointStore.getClass().getSimpleName(), this.monitorListeners.size());
    }

    @Override
    public Flux<StreamEvent> execute(AgentRun run, S initialState, AgentGraph<S> graph) {
        Objects.requireNonNull(run, "运行句柄不能为空");
        Objects.requireNonNull(initialState, "初始状态不能为空");
        Objects.requireNonNull(graph, "图不能为空");

        return Flux.create(sink -> {
            if (!run.start()) {
                sink.error(new IllegalStateException("运行只能执行一次，当前状态: " + run.getStatus()));
                return;
            }
            RunEventSink events = new RunEventSink(run, sink);
            sink.onCancel(() -> {
                if (run.cancel()) {
                    log.debug("[RequestId: {}][Graph: '{}'][Gen: {}] 下游取消订阅，已触发运行取消。",
                            run.getRequestId(), graph.getName(), run.getGeneration());
                }
            });

            RunLoop loop = new RunLoop(run, graph, events);
            loop.begin(initialState);
        });
    }

    /**
     * 单次运行的执行循环。
     */
    private final class RunLoop {

        private final AgentRun run;
        private final AgentGraph<S> graph;
        private final Router<S> router;
        private final RunEventSink events;
        private final Instant startTime = Instant.now();

        private RunLoop(AgentRun run, AgentGraph<S> graph, RunEventSink events) {
            this.run = run;
            this.graph = graph;
            this.router = new TableRouter<>(graph);
            this.events = events;
        }

        void begin(S initialState) {
            log.info("[RequestId: {}][Graph: '{}'][Session: {}][Gen: {}] 运行开始，入口节点: '{}'",
                    run.getRequestId(), graph.getName(), run.getSessionId(), run.getGeneration(), graph.getEntryNodeId());
            safeNotifyListeners(l -> l.onRunStart(run.getRequestId(), graph.getName(), run.getSessionId(), run.getGeneration()));

            step(graph.getEntryNodeId(), initialState)
                    .subscribe(
                            status -> finish(status, null),
                            error -> finish(RunStatus.ERRORED, error));
        }

        private Mono<RunStatus> step(String nodeId, S state) {
            return Mono.defer(() -> {
                if (run.isCancelled()) {
                    log.debug("[RequestId: {}][Graph: '{}'] 在节点 '{}' 之前检测到取消。", run.getRequestId(), graph.getName(), nodeId);
                    return Mono.just(RunStatus.CANCELLED);
                }
                if (run.incrementSteps() > maxSteps) {
                    return Mono.error(new StepLimitExceededException(graph.getName(), maxSteps, nodeId));
                }
                NodeDefinition definition = graph.getNode(nodeId).orElse(null);
                if (definition == null) {
                    return Mono.error(new RouterMisconfigurationException(
                            String.format("图 '%s': 节点 '%s' 未定义。", graph.getName(), nodeId)));
                }
                run.setCurrentNodeId(nodeId);
                NodeContext context = new NodeContext(run.getRequestId(), run.getSessionId(), run.getGeneration(),
                        nodeId, dispatcher, run.getToken(), events::fragment);

                return nodeExecutor.executeNode(definition, state, context, graph.getName())
                        .flatMap(result -> advance(nodeId, result))
                        .switchIfEmpty(Mono.defer(() -> run.isCancelled()
                                ? Mono.just(RunStatus.CANCELLED)
                                : Mono.error(new NodeExecutionException(nodeId, "节点未返回结果"))));
            });
        }

        private Mono<RunStatus> advance(String nodeId, NodeResult<S> result) {
            String next = router.route(nodeId, result.getState(), result.getDecision());
            run.recordCompletedNode(nodeId);
            saveCheckpoint(nodeId, next, result.getState());
            log.debug("[RequestId: {}][Graph: '{}'] 节点 '{}' -> '{}' (决策: {})",
                    run.getRequestId(), graph.getName(), nodeId, next, result.getDecision());
            if (AgentGraph.isTerminal(next)) {
                return Mono.just(RunStatus.COMPLETED);
            }
            return step(next, result.getState());
        }

        private void saveCheckpoint(String nodeId, String next, S state) {
            RunCheckpoint<S> checkpoint = RunCheckpoint.<S>builder()
                    .sessionId(run.getSessionId())
                    .generation(run.getGeneration())
                    .requestId(run.getRequestId())
                    .lastNodeId(nodeId)
                    .nextNodeId(next)
                    .state(state)
                    .nodeLog(run.getNodeLog())
                    .savedAt(Instant.now())
                    .build();
            try {
                checkpointStore.save(checkpoint);
            } catch (Exception e) {
                // 检查点只用于诊断和恢复，写入失败不终止运行
                log.error("[RequestId: {}][Graph: '{}'] 保存节点 '{}' 之后的检查点失败: {}",
                        run.getRequestId(), graph.getName(), nodeId, e.getMessage(), e);
            }
        }

        /**
         * 清理失败不影响取消帧的发出。
         */
        private void discardCheckpoint() {
            try {
                checkpointStore.discard(run.getSessionId(), run.getGeneration());
            } catch (Exception e) {
                log.error("[RequestId: {}][Graph: '{}'] 丢弃代数 {} 的检查点失败: {}",
                        run.getRequestId(), graph.getName(), run.getGeneration(), e.getMessage(), e);
            }
        }

        private void finish(RunStatus status, Throwable error) {
            Duration totalDuration = Duration.between(startTime, Instant.now());
            if (!run.finish(status)) {
                log.warn("[RequestId: {}][Graph: '{}'] 运行已处于终态 {}，忽略 {}。",
                        run.getRequestId(), graph.getName(), run.getStatus(), status);
                return;
            }
            switch (status) {
                case COMPLETED:
                    log.info("[RequestId: {}][Graph: '{}'][Gen: {}] 运行完成。节点: {}, 耗时: {}ms",
                            run.getRequestId(), graph.getName(), run.getGeneration(), run.getNodeLog(), totalDuration.toMillis());
                    break;
                case CANCELLED:
                    discardCheckpoint();
                    log.info("[RequestId: {}][Graph: '{}'][Gen: {}] 运行已取消。已完成节点: {}, 耗时: {}ms",
                            run.getRequestId(), graph.getName(), run.getGeneration(), run.getNodeLog(), totalDuration.toMillis());
                    break;
                case ERRORED:
                default:
                    log.error("[RequestId: {}][Graph: '{}'][Gen: {}] 运行失败。当前节点: '{}', 错误: {}",
                            run.getRequestId(), graph.getName(), run.getGeneration(), run.getCurrentNodeId(),
                            error != null ? error.getMessage() : "未知", error);
                    events.error(describe(error));
                    break;
            }
            events.done(status);
            safeNotifyListeners(l -> l.onRunComplete(run.getRequestId(), graph.getName(), run.getSessionId(),
                    run.getGeneration(), totalDuration, status, error));
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "未知错误";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
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
