package xyz.vvrf.reactor.agent.execution;

import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.StreamEvent;

/**
 * Agent 图执行引擎接口。
 *
 * @param <S> 状态类型
 * @author ruifeng.wen
 */
public interface AgentEngine<S> {

    /**
     * 执行一次运行。
     * <p>
     * 返回冷的事件流：订阅时开始执行，最后一个事件总是携带终态的 DONE。
     * 取消对返回流的订阅会触发运行的取消令牌。
     *
     * @param run          运行句柄 (必须处于 PENDING)
     * @param initialState 初始状态
     * @param graph        已构建的图
     * @return 运行的事件流
     */
    Flux<StreamEvent> execute(AgentRun run, S initialState, AgentGraph<S> graph);
}
