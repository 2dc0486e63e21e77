package xyz.vvrf.reactor.agent.tutor.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.ContentRepository;
import xyz.vvrf.reactor.agent.tutor.TutorState;

import java.time.Duration;
import java.util.Objects;

/**
 * 读取请求引用的学习材料，放入状态的 passages。
 *
 * @author ruifeng.wen
 */
@Slf4j
@AgentNodeType(id = ContentRetrievalNode.TYPE_ID, stateType = TutorState.class)
public class ContentRetrievalNode implements AgentNode<TutorState> {

    public static final String TYPE_ID = "contentRetrieval";

    private final ContentRepository contentRepository;

    public ContentRetrievalNode(ContentRepository contentRepository) {
        this.contentRepository = Objects.requireNonNull(contentRepository, "ContentRepository 不能为空");
    }

    @Override
    public Duration getExecutionTimeout() {
        return Duration.ofSeconds(10);
    }

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        return contentRepository.findByIds(state.getContentIds())
                .collectList()
                .map(passages -> {
                    if (passages.size() < state.getContentIds().size()) {
                        log.warn("[RequestId: {}] 请求了 {} 份材料，只找到 {} 份。", context.getRequestId(),
                                state.getContentIds().size(), passages.size());
                    }
                    return NodeResult.of(state.withPassages(passages));
                });
    }
}
