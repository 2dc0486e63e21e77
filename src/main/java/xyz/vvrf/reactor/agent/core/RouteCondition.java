package xyz.vvrf.reactor.agent.core;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 路由边的条件。根据节点返回的状态和决策判断该边是否匹配。
 * 条件必须是纯函数，不能有副作用。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@FunctionalInterface
public interface RouteCondition<S> {

    boolean matches(S state, Enum<?> decision);

    /**
     * 决策等于给定常量时匹配。
     */
    static <S> RouteCondition<S> onDecision(Enum<?> expected) {
        Objects.requireNonNull(expected, "决策常量不能为空");
        return (state, decision) -> expected == decision;
    }

    /**
     * 状态满足谓词时匹配。
     */
    static <S> RouteCondition<S> onState(Predicate<? super S> predicate) {
        Objects.requireNonNull(predicate, "状态谓词不能为空");
        return (state, decision) -> predicate.test(state);
    }

    static <S> RouteCondition<S> always() {
        return (state, decision) -> true;
    }

    default RouteCondition<S> and(RouteCondition<S> other) {
        Objects.requireNonNull(other, "条件不能为空");
        return (state, decision) -> matches(state, decision) && other.matches(state, decision);
    }
}
