package xyz.vvrf.reactor.agent.tutor.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.TutorPrompts;
import xyz.vvrf.reactor.agent.tutor.TutorState;

/**
 * 普通对话回复。
 */
@AgentNodeType(id = GeneralResponseNode.TYPE_ID, stateType = TutorState.class)
public class GeneralResponseNode extends StreamingTutorNode {

    public static final String TYPE_ID = "generalResponse";

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        return streamText(TutorPrompts.general(state), context)
                .map(text -> NodeResult.of(state.withResponse(text)));
    }
}
