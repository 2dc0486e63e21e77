package xyz.vvrf.reactor.agent.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 路由表中的一条边：条件 + 目标节点 ID (或 {@link AgentGraph#TERMINAL})。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Getter
public final class RouteEdge<S> {

    private final RouteCondition<S> condition;
    private final String targetId;
    private final String label;
    private final boolean defaultEdge;

    private RouteEdge(RouteCondition<S> condition, String targetId, String label, boolean defaultEdge) {
        this.condition = Objects.requireNonNull(condition, "边条件不能为空");
        this.targetId = Objects.requireNonNull(targetId, "目标节点 ID 不能为空");
        this.label = label;
        this.defaultEdge = defaultEdge;
    }

    public static <S> RouteEdge<S> conditional(RouteCondition<S> condition, String targetId, String label) {
        return new RouteEdge<>(condition, targetId, label, false);
    }

    public static <S> RouteEdge<S> fallback(String targetId) {
        return new RouteEdge<>(RouteCondition.always(), targetId, "default", true);
    }

    public boolean matches(S state, Enum<?> decision) {
        return condition.matches(state, decision);
    }

    @Override
    public String toString() {
        return "RouteEdge{" + (label != null ? label : "?") + " -> " + targetId + '}';
    }
}
