package xyz.vvrf.reactor.agent.execution;

import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.RouteTable;
import xyz.vvrf.reactor.agent.core.Router;
import xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException;

import java.util.Objects;

/**
 * 基于图的路由表的 {@link Router}。按声明顺序求值，第一条匹配的边胜出。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public class TableRouter<S> implements Router<S> {

    private final AgentGraph<S> graph;

    public TableRouter(AgentGraph<S> graph) {
        this.graph = Objects.requireNonNull(graph, "图不能为空");
    }

    @Override
    public String route(String nodeId, S state, Enum<?> decision) {
        RouteTable<S> table = graph.getRouteTable(nodeId)
                .orElseThrow(() -> new RouterMisconfigurationException(
                        String.format("图 '%s': 节点 '%s' 没有路由表。", graph.getName(), nodeId)));
        String target = table.select(state, decision);
        if (target == null) {
            throw new RouterMisconfigurationException(
                    String.format("图 '%s': 节点 '%s' 没有匹配的边 (决策: %s)。", graph.getName(), nodeId, decision));
        }
        if (!AgentGraph.isTerminal(target) && !graph.getNode(target).isPresent()) {
            throw new RouterMisconfigurationException(
                    String.format("图 '%s': 节点 '%s' 路由到未定义的节点 '%s'。", graph.getName(), nodeId, target));
        }
        return target;
    }
}
