package xyz.vvrf.reactor.agent.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.NodeDefinition;
import xyz.vvrf.reactor.agent.core.RouteCondition;
import xyz.vvrf.reactor.agent.core.RouteEdge;
import xyz.vvrf.reactor.agent.core.RouteTable;
import xyz.vvrf.reactor.agent.registry.NodeRegistry;
import xyz.vvrf.reactor.agent.util.GraphUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建 {@link AgentGraph} 的构建器。
 * <pre>{@code
 * AgentGraph<MyState> graph = new AgentGraphBuilder<>("my-graph", registry)
 *         .node("analyze", "intentAnalysis")
 *         .node("explain", "explanation")
 *         .entry("analyze")
 *         .route("analyze")
 *             .when(RouteCondition.onDecision(Intent.EXPLAIN), "explain")
 *             .otherwise(AgentGraph.TERMINAL)
 *         .route("explain").otherwise(AgentGraph.TERMINAL)
 *         .build();
 * }</pre>
 * 所有路由配置错误都在 {@link #build()} 时以
 * {@link xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException} 抛出。
 * 构建成功后会记录图的 DOT 描述。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Slf4j
public class AgentGraphBuilder<S> {

    private final String graphName;
    private final NodeRegistry<S> nodeRegistry;
    private final Map<String, NodeDefinition> nodeDefinitions = new LinkedHashMap<>();
    private final Map<String, List<RouteEdge<S>>> routes = new LinkedHashMap<>();
    private String entryNodeId;

    public AgentGraphBuilder(String graphName, NodeRegistry<S> nodeRegistry) {
        if (graphName == null || graphName.trim().isEmpty()) {
            throw new IllegalArgumentException("图名称不能为空");
        }
        this.graphName = graphName;
        this.nodeRegistry = Objects.requireNonNull(nodeRegistry, "NodeRegistry 不能为空");
        log.debug("为状态 '{}' 创建 AgentGraphBuilder: {}", nodeRegistry.getStateType().getSimpleName(), graphName);
    }

    public AgentGraphBuilder<S> node(String instanceId, String nodeTypeId) {
        return node(instanceId, nodeTypeId, null);
    }

    /**
     * 添加节点实例。
     *
     * @param timeout 实例级超时覆盖，可为 null
     */
    public AgentGraphBuilder<S> node(String instanceId, String nodeTypeId, Duration timeout) {
        Objects.requireNonNull(instanceId, "实例 ID 不能为空");
        if (AgentGraph.isTerminal(instanceId)) {
            throw new IllegalArgumentException(String.format("实例 ID '%s' 是保留的终止标识", instanceId));
        }
        if (nodeDefinitions.containsKey(instanceId)) {
            throw new IllegalArgumentException(String.format("图 '%s' 中实例 ID '%s' 重复", graphName, instanceId));
        }
        nodeDefinitions.put(instanceId, new NodeDefinition(instanceId, nodeTypeId, timeout));
        return this;
    }

    public AgentGraphBuilder<S> entry(String instanceId) {
        this.entryNodeId = Objects.requireNonNull(instanceId, "入口节点 ID 不能为空");
        return this;
    }

    /**
     * 开始声明某个节点的路由表。
     */
    public RouteBuilder route(String fromInstanceId) {
        Objects.requireNonNull(fromInstanceId, "节点 ID 不能为空");
        if (routes.containsKey(fromInstanceId)) {
            throw new IllegalArgumentException(String.format("图 '%s' 中节点 '%s' 的路由表已声明", graphName, fromInstanceId));
        }
        List<RouteEdge<S>> edges = new ArrayList<>();
        routes.put(fromInstanceId, edges);
        return new RouteBuilder(fromInstanceId, edges);
    }

    /**
     * 校验并构建图。
     *
     * @throws xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException 如果配置有误
     */
    public AgentGraph<S> build() {
        log.info("开始构建图 '{}' (状态: {})...", graphName, nodeRegistry.getStateType().getSimpleName());

        Map<String, RouteTable<S>> routeTables = new LinkedHashMap<>();
        for (Map.Entry<String, List<RouteEdge<S>>> entry : routes.entrySet()) {
            routeTables.put(entry.getKey(), new RouteTable<>(entry.getKey(), entry.getValue()));
        }

        GraphUtils.validateGraphStructure(graphName, entryNodeId, nodeDefinitions, routeTables, nodeRegistry);

        String dot = GraphUtils.toDot(graphName, entryNodeId, nodeDefinitions, routeTables);
        log.info("图 '{}' 构建完成。节点: {}, 入口: '{}'", graphName, nodeDefinitions.keySet(), entryNodeId);
        log.info("图 '{}' DOT 图形描述:\n--- DOT BEGIN ---\n{}--- DOT END ---", graphName, dot);

        return new AgentGraph<>(graphName, nodeRegistry.getStateType(), entryNodeId, nodeDefinitions, routeTables, dot);
    }

    /**
     * 单个节点的路由表构建器。边按声明顺序求值，必须以 {@link #otherwise(String)} 结束。
     */
    public final class RouteBuilder {

        private final String fromInstanceId;
        private final List<RouteEdge<S>> edges;

        private RouteBuilder(String fromInstanceId, List<RouteEdge<S>> edges) {
            this.fromInstanceId = fromInstanceId;
            this.edges = edges;
        }

        public RouteBuilder when(RouteCondition<S> condition, String targetId) {
            return when(condition, targetId, null);
        }

        public RouteBuilder when(RouteCondition<S> condition, String targetId, String label) {
            edges.add(RouteEdge.conditional(condition, targetId, label));
            return this;
        }

        /**
         * 决策等于给定常量时转到目标，边标签为常量名。
         */
        public RouteBuilder onDecision(Enum<?> decision, String targetId) {
            return when(RouteCondition.onDecision(decision), targetId, decision.name());
        }

        /**
         * 声明默认边并结束此路由表。
         */
        public AgentGraphBuilder<S> otherwise(String targetId) {
            edges.add(RouteEdge.fallback(targetId));
            log.trace("图 '{}': 节点 '{}' 的路由表声明完成，共 {} 条边", graphName, fromInstanceId, edges.size());
            return AgentGraphBuilder.this;
        }

        /**
         * 不声明默认边就回到图构建器。build() 时若该节点可达将报错。
         */
        public AgentGraphBuilder<S> end() {
            return AgentGraphBuilder.this;
        }
    }
}
