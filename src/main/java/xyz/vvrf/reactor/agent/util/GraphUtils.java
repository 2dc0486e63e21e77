package xyz.vvrf.reactor.agent.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.NodeDefinition;
import xyz.vvrf.reactor.agent.core.RouteEdge;
import xyz.vvrf.reactor.agent.core.RouteTable;
import xyz.vvrf.reactor.agent.exception.RouterMisconfigurationException;
import xyz.vvrf.reactor.agent.registry.NodeRegistry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供 Agent 图结构校验、可达性分析和 DOT 渲染的工具方法。
 * 图允许环路，因此这里不做循环检测。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {
    }

    /**
     * 校验图结构：入口存在、节点类型已注册、所有目标存在、每个可达节点都有以默认边结尾的路由表。
     *
     * @throws RouterMisconfigurationException 如果校验失败
     */
    public static <S> void validateGraphStructure(
            String graphName,
            String entryNodeId,
            Map<String, NodeDefinition> nodes,
            Map<String, RouteTable<S>> routeTables,
            NodeRegistry<S> nodeRegistry) {

        log.debug("图 '{}': 开始结构校验...", graphName);

        if (nodes.isEmpty()) {
            throw new RouterMisconfigurationException(String.format("图 '%s': 没有定义任何节点。", graphName));
        }
        if (entryNodeId == null) {
            throw new RouterMisconfigurationException(String.format("图 '%s': 未指定入口节点。", graphName));
        }
        if (!nodes.containsKey(entryNodeId)) {
            throw new RouterMisconfigurationException(String.format("图 '%s': 入口节点 '%s' 未定义。", graphName, entryNodeId));
        }

        for (NodeDefinition node : nodes.values()) {
            if (!nodeRegistry.getNodeMetadata(node.getNodeTypeId()).isPresent()) {
                throw new RouterMisconfigurationException(String.format("图 '%s': 节点 '%s' 的类型 '%s' 未在注册表 (状态: %s) 中注册。",
                        graphName, node.getInstanceId(), node.getNodeTypeId(), nodeRegistry.getStateType().getSimpleName()));
            }
        }

        for (RouteTable<S> table : routeTables.values()) {
            if (!nodes.containsKey(table.getNodeId())) {
                throw new RouterMisconfigurationException(String.format("图 '%s': 为未定义的节点 '%s' 声明了路由表。",
                        graphName, table.getNodeId()));
            }
            List<RouteEdge<S>> edges = table.getEdges();
            for (int i = 0; i < edges.size(); i++) {
                RouteEdge<S> edge = edges.get(i);
                String target = edge.getTargetId();
                if (!AgentGraph.isTerminal(target) && !nodes.containsKey(target)) {
                    throw new RouterMisconfigurationException(String.format("图 '%s': 节点 '%s' 的边指向不存在的节点 '%s'。",
                            graphName, table.getNodeId(), target));
                }
                if (edge.isDefaultEdge() && i != edges.size() - 1) {
                    throw new RouterMisconfigurationException(String.format("图 '%s': 节点 '%s' 的默认边必须是最后一条边。",
                            graphName, table.getNodeId()));
                }
            }
        }

        Set<String> reachable = reachableFrom(entryNodeId, routeTables);
        for (String nodeId : reachable) {
            RouteTable<S> table = routeTables.get(nodeId);
            if (table == null || !table.hasDefaultEdge()) {
                throw new RouterMisconfigurationException(String.format("图 '%s': 节点 '%s' 缺少默认边 (otherwise)。",
                        graphName, nodeId));
            }
        }

        for (String nodeId : nodes.keySet()) {
            if (!reachable.contains(nodeId)) {
                log.warn("图 '{}': 节点 '{}' 从入口 '{}' 不可达，将永远不会执行。", graphName, nodeId, entryNodeId);
            }
        }
        log.debug("图 '{}': 结构校验通过。可达节点: {}", graphName, reachable);
    }

    /**
     * 从入口出发沿所有边可达的节点 (不含 TERMINAL)，按发现顺序。
     */
    public static <S> Set<String> reachableFrom(String entryNodeId, Map<String, RouteTable<S>> routeTables) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entryNodeId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (AgentGraph.isTerminal(current) || !visited.add(current)) {
                continue;
            }
            RouteTable<S> table = routeTables.get(current);
            if (table != null) {
                for (RouteEdge<S> edge : table.getEdges()) {
                    queue.add(edge.getTargetId());
                }
            }
        }
        return visited;
    }

    /**
     * 生成 DOT 图形描述代码。
     */
    public static <S> String toDot(String graphName,
                                   String entryNodeId,
                                   Map<String, NodeDefinition> nodes,
                                   Map<String, RouteTable<S>> routeTables) {
        StringBuilder dot = new StringBuilder();
        String safeName = escapeDotString(graphName);
        dot.append(String.format("digraph \"%s\" {\n", safeName));
        dot.append("  rankdir=LR;\n");
        dot.append(String.format("  label=\"%s\";\n", safeName));
        dot.append("  node [shape=box, style=rounded];\n");
        dot.append(String.format("  \"%s\" [shape=doublecircle, label=\"END\"];\n", AgentGraph.TERMINAL));

        for (NodeDefinition node : nodes.values()) {
            String id = escapeDotString(node.getInstanceId());
            String label = id + "\\n(" + escapeDotString(node.getNodeTypeId()) + ")";
            String extra = node.getInstanceId().equals(entryNodeId) ? ", penwidth=2" : "";
            dot.append(String.format("  \"%s\" [label=\"%s\"%s];\n", id, label, extra));
        }

        for (RouteTable<S> table : routeTables.values()) {
            int order = 1;
            for (RouteEdge<S> edge : table.getEdges()) {
                String label = edge.isDefaultEdge() ? "otherwise" : (edge.getLabel() != null ? edge.getLabel() : "when");
                String style = edge.isDefaultEdge() ? ", style=dashed" : "";
                dot.append(String.format("  \"%s\" -> \"%s\" [label=\"%d: %s\"%s];\n",
                        escapeDotString(table.getNodeId()), escapeDotString(edge.getTargetId()),
                        order++, escapeDotString(label), style));
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    private static String escapeDotString(String input) {
        if (input == null) {
            return "";
        }
        return input.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
