package xyz.vvrf.reactor.agent.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * 节点执行结果：新的状态 + 可选的路由决策。
 * <p>
 * 决策是一个封闭的枚举常量，路由表中的边通过决策或状态谓词选择下一个节点。
 * 输出片段不放在结果里，节点执行期间通过 {@link NodeContext#emit(String)} 立即发送。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
@Getter
@ToString
@EqualsAndHashCode
public final class NodeResult<S> {

    private final S state;
    private final Enum<?> decision;

    private NodeResult(S state, Enum<?> decision) {
        this.state = Objects.requireNonNull(state, "节点结果状态不能为空");
        this.decision = decision;
    }

    public static <S> NodeResult<S> of(S state) {
        return new NodeResult<>(state, null);
    }

    public static <S> NodeResult<S> of(S state, Enum<?> decision) {
        return new NodeResult<>(state, decision);
    }

    public Optional<Enum<?>> getDecisionOptional() {
        return Optional.ofNullable(decision);
    }
}
