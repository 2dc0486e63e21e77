package xyz.vvrf.reactor.agent.core;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 已构建并校验过的 Agent 图。只读，可在多个运行之间共享。
 * 通过 {@link xyz.vvrf.reactor.agent.builder.AgentGraphBuilder} 创建。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Getter
public final class AgentGraph<S> {

    /**
     * 路由到此目标表示运行成功结束。
     */
    public static final String TERMINAL = "__end__";

    private final String name;
    private final Class<S> stateType;
    private final String entryNodeId;
    private final Map<String, NodeDefinition> nodes;
    private final Map<String, RouteTable<S>> routeTables;
    private final String dotRepresentation;

    public AgentGraph(String name,
                      Class<S> stateType,
                      String entryNodeId,
                      Map<String, NodeDefinition> nodes,
                      Map<String, RouteTable<S>> routeTables,
                      String dotRepresentation) {
        this.name = Objects.requireNonNull(name, "图名称不能为空");
        this.stateType = Objects.requireNonNull(stateType, "状态类型不能为空");
        this.entryNodeId = Objects.requireNonNull(entryNodeId, "入口节点不能为空");
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.routeTables = Collections.unmodifiableMap(new LinkedHashMap<>(routeTables));
        this.dotRepresentation = dotRepresentation;
    }

    public Optional<NodeDefinition> getNode(String instanceId) {
        return Optional.ofNullable(nodes.get(instanceId));
    }

    public Optional<RouteTable<S>> getRouteTable(String instanceId) {
        return Optional.ofNullable(routeTables.get(instanceId));
    }

    public static boolean isTerminal(String nodeId) {
        return TERMINAL.equals(nodeId);
    }
}
