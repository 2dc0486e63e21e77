package xyz.vvrf.reactor.agent.tutor.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.TutorPrompts;
import xyz.vvrf.reactor.agent.tutor.TutorState;

/**
 * 按当前难度流式生成练习题。接在讲解之后时，先输出一个分隔段落。
 *
 * @author ruifeng.wen
 */
@AgentNodeType(id = PracticeGenerationNode.TYPE_ID, stateType = TutorState.class)
public class PracticeGenerationNode extends StreamingTutorNode {

    public static final String TYPE_ID = "practiceGeneration";

    static final String SECTION_BREAK = "\n\n";

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        return Mono.defer(() -> {
            boolean followsExplanation = state.getExplanation() != null;
            if (followsExplanation) {
                context.emit(SECTION_BREAK);
            }
            return streamText(TutorPrompts.practice(state), context)
                    .map(questions -> {
                        String response = followsExplanation ? state.getExplanation() + SECTION_BREAK + questions : questions;
                        return NodeResult.of(state.withPracticeQuestions(questions).withResponse(response));
                    });
        });
    }
}
