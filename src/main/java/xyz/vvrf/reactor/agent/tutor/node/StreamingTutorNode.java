package xyz.vvrf.reactor.agent.tutor.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.tutor.TutorState;

/**
 * 流式生成文本的辅导节点基类。每个分块立即通过 {@link NodeContext#emit(String)} 发送给客户端，
 * 同时累积为完整文本。运行被取消时返回空，不产出新状态。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class StreamingTutorNode implements AgentNode<TutorState> {

    protected Mono<String> streamText(CompletionRequest request, NodeContext context) {
        return Mono.defer(() -> {
            StringBuilder text = new StringBuilder();
            return context.getDispatcher().stream(request, context.getCancellationToken())
                    .doOnNext(chunk -> {
                        text.append(chunk);
                        context.emit(chunk);
                    })
                    .then(Mono.fromCallable(text::toString))
                    .filter(result -> {
                        if (context.isCancelled()) {
                            log.debug("[RequestId: {}] 节点 '{}' 在流式输出期间被取消，丢弃 {} 个字符。",
                                    context.getRequestId(), context.getNodeId(), result.length());
                            return false;
                        }
                        return true;
                    });
        });
    }
}
