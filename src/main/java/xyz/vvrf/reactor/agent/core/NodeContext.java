package xyz.vvrf.reactor.agent.core;

import lombok.Getter;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * 节点执行时可见的运行环境。
 * 由引擎为每一步创建，节点不应持有它超过一次执行。
 *
 * @author ruifeng.wen
 */
@Getter
public final class NodeContext {

    private final String requestId;
    private final String sessionId;
    private final long generation;
    private final String nodeId;
    private final ProviderDispatcher dispatcher;
    private final CancellationToken cancellationToken;
    private final Predicate<String> fragmentSink;

    public NodeContext(String requestId,
                       String sessionId,
                       long generation,
                       String nodeId,
                       ProviderDispatcher dispatcher,
                       CancellationToken cancellationToken,
                       Predicate<String> fragmentSink) {
        this.requestId = Objects.requireNonNull(requestId, "请求 ID 不能为空");
        this.sessionId = Objects.requireNonNull(sessionId, "会话 ID 不能为空");
        this.generation = generation;
        this.nodeId = Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        this.dispatcher = Objects.requireNonNull(dispatcher, "提供方调度器不能为空");
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "取消令牌不能为空");
        this.fragmentSink = Objects.requireNonNull(fragmentSink, "片段接收器不能为空");
    }

    /**
     * 立即向客户端发送一个输出片段 (不做批量)。
     *
     * @param fragment 片段文本，空串会被忽略
     * @return 片段是否被接受；运行已取消或已结束时返回 false
     */
    public boolean emit(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return false;
        }
        return fragmentSink.test(fragment);
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }
}
