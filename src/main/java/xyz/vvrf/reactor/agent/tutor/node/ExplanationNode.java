package xyz.vvrf.reactor.agent.tutor.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.ActionItemExtractor;
import xyz.vvrf.reactor.agent.tutor.TutorPrompts;
import xyz.vvrf.reactor.agent.tutor.TutorState;

/**
 * 流式生成概念讲解，并提取其中的学习建议。
 *
 * @author ruifeng.wen
 */
@AgentNodeType(id = ExplanationNode.TYPE_ID, stateType = TutorState.class)
public class ExplanationNode extends StreamingTutorNode {

    public static final String TYPE_ID = "explanation";

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        return streamText(TutorPrompts.explanation(state), context)
                .map(text -> NodeResult.of(state
                        .withExplanation(text)
                        .withResponse(text)
                        .withActionItems(ActionItemExtractor.extract(text))));
    }
}
