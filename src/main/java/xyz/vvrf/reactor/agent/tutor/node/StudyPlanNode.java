package xyz.vvrf.reactor.agent.tutor.node;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.annotation.AgentNodeType;
import xyz.vvrf.reactor.agent.core.NodeContext;
import xyz.vvrf.reactor.agent.core.NodeResult;
import xyz.vvrf.reactor.agent.tutor.ActionItemExtractor;
import xyz.vvrf.reactor.agent.tutor.TutorPrompts;
import xyz.vvrf.reactor.agent.tutor.TutorState;

import java.time.Duration;

@AgentNodeType(id = StudyPlanNode.TYPE_ID, stateType = TutorState.class)
public class StudyPlanNode extends StreamingTutorNode {

    public static final String TYPE_ID = "studyPlan";

    @Override
    public Duration getExecutionTimeout() {
        return Duration.ofMinutes(3);
    }

    @Override
    public Mono<NodeResult<TutorState>> execute(TutorState state, NodeContext context) {
        return streamText(TutorPrompts.studyPlan(state), context)
                .map(plan -> NodeResult.of(state
                        .withStudyPlan(plan)
                        .withResponse(plan)
                        .withActionItems(ActionItemExtractor.extract(plan))));
    }
}
