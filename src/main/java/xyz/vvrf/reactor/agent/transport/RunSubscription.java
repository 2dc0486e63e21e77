package xyz.vvrf.reactor.agent.transport;

import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.agent.core.StreamEvent;
import xyz.vvrf.reactor.agent.execution.AgentRun;

/**
 * 运行准入后返回给调用方的订阅句柄。
 *
 * @author ruifeng.wen
 */
public interface RunSubscription {

    AgentRun getRun();

    default long getGeneration() {
        return getRun().getGeneration();
    }

    /**
     * 该运行对调用方可见的事件序列。
     * 每次订阅都从序号 0 开始重放；运行被取代后序列立即结束，运行的终态事件到达时序列关闭。
     * 取消对该序列的订阅会触发运行的取消令牌。
     */
    Flux<StreamEvent> events();

    /**
     * 显式取消运行。
     */
    boolean cancel();
}
