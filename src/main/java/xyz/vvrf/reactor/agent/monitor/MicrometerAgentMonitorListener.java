package xyz.vvrf.reactor.agent.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.dispatch.ProviderCallAttempt;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class MicrometerAgentMonitorListener implements AgentMonitorListener {

    // 指标名称
    static final String METRIC_RUN_TIME = "agent.run.time";
    static final String METRIC_NODE_EXECUTION_TIME = "agent.node.execution.time";
    static final String METRIC_NODE_EXECUTION_TOTAL = "agent.node.execution.total";
    static final String METRIC_NODE_TIMEOUT_TOTAL = "agent.node.timeout.total";
    static final String METRIC_PROVIDER_ATTEMPT_TOTAL = "agent.provider.attempt.total";
    static final String METRIC_PROVIDER_LATENCY = "agent.provider.latency";

    // 标签键
    private static final String TAG_GRAPH_NAME = "graph.name";
    private static final String TAG_NODE_ID = "node.id";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";
    private static final String TAG_PROVIDER = "provider";
    private static final String TAG_CAPABILITY = "capability";
    private static final String TAG_OUTCOME = "outcome";

    private static final String STATUS_SUCCESS = "SUCCESS";
    private static final String STATUS_FAILURE = "FAILURE";
    private static final String STATUS_TIMEOUT = "TIMEOUT";

    private final MeterRegistry meterRegistry;

    public MicrometerAgentMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onRunComplete(String requestId, String graphName, String sessionId, long generation,
                              Duration totalDuration, RunStatus status, Throwable error) {
        Tags tags = Tags.of(Tag.of(TAG_GRAPH_NAME, graphName), Tag.of(TAG_STATUS, status.name()));
        recordTimer(METRIC_RUN_TIME, "Agent 运行总耗时", tags, totalDuration);
    }

    @Override
    public void onNodeStart(String requestId, String graphName, String nodeId, AgentNode<?> node) {
        // 计时器在结束时记录
    }

    @Override
    public void onNodeSuccess(String requestId, String graphName, String nodeId, Duration duration, NodeResult<?> result) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "Agent 节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的节点执行总数", tags);
    }

    @Override
    public void onNodeFailure(String requestId, String graphName, String nodeId, Duration duration, Throwable error, AgentNode<?> node) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        String status = (error instanceof TimeoutException) ? STATUS_TIMEOUT : STATUS_FAILURE;
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_NODE_ID, nodeId),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(METRIC_NODE_EXECUTION_TIME, "Agent 节点执行时间", tags, duration);
        incrementCounter(METRIC_NODE_EXECUTION_TOTAL, "按状态统计的节点执行总数", tags);
    }

    @Override
    public void onNodeTimeout(String requestId, String graphName, String nodeId, Duration timeout, AgentNode<?> node) {
        Tags tags = Tags.of(Tag.of(TAG_GRAPH_NAME, graphName), Tag.of(TAG_NODE_ID, nodeId));
        incrementCounter(METRIC_NODE_TIMEOUT_TOTAL, "节点超时次数", tags);
    }

    @Override
    public void onProviderAttempt(ProviderCallAttempt attempt) {
        Tags tags = Tags.of(
                Tag.of(TAG_PROVIDER, attempt.getProviderName()),
                Tag.of(TAG_CAPABILITY, attempt.getCapability().name()),
                Tag.of(TAG_OUTCOME, attempt.getOutcome().name())
        );
        incrementCounter(METRIC_PROVIDER_ATTEMPT_TOTAL, "提供方调用次数", tags);
        recordTimer(METRIC_PROVIDER_LATENCY, "提供方调用耗时", tags, attempt.getLatency());
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry)
                    .record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(String name, String description, Tags tags) {
        try {
            Counter.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            log.error("增加计数器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }
}
