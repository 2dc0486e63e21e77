package xyz.vvrf.reactor.agent.core;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Agent 图中的处理节点 - 一个可复用的逻辑单元。
 * 节点实现应该是线程安全的，特别是当它们作为原型（单例）注册时。
 * <p>
 * 引擎不会重试节点；需要容错的外部调用应通过 {@link NodeContext#getDispatcher()} 完成。
 *
 * @param <S> 状态类型 (State Type)
 * @author ruifeng.wen
 */
public interface AgentNode<S> {

    /**
     * 获取节点执行超时。
     * 如果返回 null 或非正数 Duration，将使用引擎的默认超时时间。
     *
     * @return 超时时间，如果不指定则返回 null
     */
    default Duration getExecutionTimeout() {
        return null;
    }

    /**
     * 执行节点逻辑。
     *
     * @param state   当前状态 (不可变)
     * @param context 本次执行的运行环境，用于调用提供方、发送片段和检查取消
     * @return 包含新状态和路由决策的 Mono。
     *         如果运行已被取消，可以返回空 Mono。
     *         无法恢复的错误应返回 Mono.error(exception)。
     */
    Mono<NodeResult<S>> execute(S state, NodeContext context);
}
