package xyz.vvrf.reactor.agent.core;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 一个节点的有序出边列表。构建完成后只读。
 * 按声明顺序求值，第一条匹配的边胜出；最后一条边是默认边，保证总能选出目标。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Getter
public final class RouteTable<S> {

    private final String nodeId;
    private final List<RouteEdge<S>> edges;

    public RouteTable(String nodeId, List<RouteEdge<S>> edges) {
        this.nodeId = Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        this.edges = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(edges, "边列表不能为空")));
    }

    public boolean hasDefaultEdge() {
        return !edges.isEmpty() && edges.get(edges.size() - 1).isDefaultEdge();
    }

    /**
     * 选择第一条匹配的边的目标。
     *
     * @return 目标节点 ID；没有任何边匹配时返回 null (只会出现在未经构建校验的表上)
     */
    public String select(S state, Enum<?> decision) {
        for (RouteEdge<S> edge : edges) {
            if (edge.matches(state, decision)) {
                return edge.getTargetId();
            }
        }
        return null;
    }
}
