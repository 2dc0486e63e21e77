package xyz.vvrf.reactor.agent.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * 用于测试目的的可配置 AgentNode 实现。
 * 使用 Builder 模式进行配置。
 *
 * @param <S> 状态类型
 */
public class TestAgentNode<S> implements AgentNode<S> {

    private final String name;
    private final BiFunction<S, NodeContext, Mono<NodeResult<S>>> executionLogic;
    private final Duration executionTimeout;
    private final AtomicInteger invocations = new AtomicInteger();

    private TestAgentNode(Builder<S> builder) {
        this.name = Objects.requireNonNull(builder.name, "节点名称不能为空");
        this.executionLogic = builder.executionLogic;
        this.executionTimeout = builder.executionTimeout;
    }

    public String getName() {
        return name;
    }

    public int getInvocations() {
        return invocations.get();
    }

    @Override
    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    @Override
    public Mono<NodeResult<S>> execute(S state, NodeContext context) {
        invocations.incrementAndGet();
        return executionLogic.apply(state, context);
    }

    public static <S> Builder<S> builder(String name) {
        return new Builder<>(name);
    }

    public static class Builder<S> {
        private final String name;
        private BiFunction<S, NodeContext, Mono<NodeResult<S>>> executionLogic = (state, ctx) -> Mono.just(NodeResult.of(state));
        private Duration executionTimeout = null;

        Builder(String name) {
            this.name = name;
        }

        public Builder<S> executionLogic(BiFunction<S, NodeContext, Mono<NodeResult<S>>> executionLogic) {
            this.executionLogic = Objects.requireNonNull(executionLogic);
            return this;
        }

        /**
         * 依次发送给定片段，然后返回状态变换结果和决策。
         */
        public Builder<S> emits(List<String> fragments, UnaryOperator<S> transform, Enum<?> decision) {
            this.executionLogic = (state, ctx) -> Mono.fromCallable(() -> {
                for (String fragment : fragments) {
                    ctx.emit(fragment);
                }
                return NodeResult.of(transform.apply(state), decision);
            });
            return this;
        }

        public Builder<S> emits(String... fragments) {
            return emits(Arrays.asList(fragments), UnaryOperator.identity(), null);
        }

        public Builder<S> decides(Enum<?> decision) {
            return emits(Arrays.<String>asList(), UnaryOperator.identity(), decision);
        }

        public Builder<S> failsWith(Throwable error) {
            this.executionLogic = (state, ctx) -> Mono.error(error);
            return this;
        }

        /**
         * 永远不结束，直到运行被取消。
         */
        public Builder<S> hangs() {
            this.executionLogic = (state, ctx) -> Mono.never();
            return this;
        }

        public Builder<S> executionTimeout(Duration executionTimeout) {
            this.executionTimeout = executionTimeout;
            return this;
        }

        public TestAgentNode<S> build() {
            return new TestAgentNode<>(this);
        }
    }
}
