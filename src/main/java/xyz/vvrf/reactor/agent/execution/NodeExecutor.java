package xyz.vvrf.reactor.agent.execution;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeDefinition;
import xyz.vvrf.reactor.agent.core.NodeResult;

/**
 * 节点执行器接口，负责执行单个节点实例。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public interface NodeExecutor<S> {

    /**
     * 执行节点。
     *
     * @param nodeDefinition 节点实例定义
     * @param state          当前状态
     * @param context        本次执行的运行环境
     * @param graphName      图名称，用于日志和监控
     * @return 节点结果；运行被取消时为空；失败时以
     *         {@link xyz.vvrf.reactor.agent.exception.NodeExecutionException} 结束
     */
    Mono<NodeResult<S>> executeNode(NodeDefinition nodeDefinition, S state, NodeContext context, String graphName);
}
