package xyz.vvrf.reactor.agent.tutor.node;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.AgentNode;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.Intent;
import xyz.vvrf.reactor.agent.tutor.TutorPrompts;
import xyz.vvrf.reactor.agent.tutor.TutorState;

/**
 * 判断学生请求的意图。显式动作直接决定意图，否则调用模型分类。
 * 路由决策为 {@link Intent}。
 *
 * @author ruifeng.wen
 */
@Slf4j
@AgentNodeType(id = IntentAnalysisNode.TYPE_ID, stateType = TutorState.class)
public class IntentAnalysisNode implements AgentNode<TutorState> {

    public static final String TYPE_ID = "intentAnalysis";

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        if (state.hasExplicitAction()) {
            Intent intent = state.getRequestedAction().toIntent();
            log.debug("[RequestId: {}] 显式动作 {} -> 意图 {}", context.getRequestId(), state.getRequestedAction(), intent);
            return Mono.just(result(state, intent));
        }
        return context.getDispatcher().complete(TutorPrompts.intent(state), context.getCancellationToken())
                .filter(outcome -> !outcome.isCancelled())
                .map(outcome -> {
                    Intent intent = Intent.fromLabel(outcome.getValue());
                    log.debug("[RequestId: {}] 意图分类: '{}' -> {} (提供方: {}, 缓存: {})", context.getRequestId(),
                            outcome.getValue(), intent, outcome.getProviderName(), outcome.isFromCache());
                    return result(state, intent);
                });
    }

    private static NodeResult<TutorState> result(TutorState state, Intent intent) {
        TutorState next = state.withIntent(intent).withPracticeRequested(intent.wantsPractice());
        return NodeResult.of(next, intent);
    }
}
