package xyz.vvrf.reactor.agent.tutor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.agent.builder.AgentGraphBuilder;
import xyz.vvrf.reactor.agent.checkpoint.CaffeineCheckpointStore;
import xyz.vvrf.reactor.agent.checkpoint.CheckpointStore;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;
import xyz.vvrf.reactor.agent.execution.AgentEngine;
import xyz.vvrf.reactor.agent.execution.StandardAgentEngine;
import xyz.vvrf.reactor.agent.execution.StandardNodeExecutor;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;
import xyz.vvrf.reactor.agent.registry.NodeRegistry;
import xyz.vvrf.reactor.agent.registry.SpringScanningNodeRegistry;
import xyz.vvrf.reactor.agent.spring.boot.AgentFrameworkProperties;
import xyz.vvrf.reactor.agent.tutor.node.ContentRetrievalNode;
import xyz.vvrf.reactor.agent.tutor.node.ExplanationNode;
import xyz.vvrf.reactor.agent.tutor.node.GeneralResponseNode;
import xyz.vvrf.reactor.agent.tutor.node.IntentAnalysisNode;
import xyz.vvrf.reactor.agent.tutor.node.PracticeGenerationNode;
import xyz.vvrf.reactor.agent.tutor.node.StudyPlanNode;

import java.util.List;

/**
 * 辅导图的定义和执行组件。
 * <pre>
 * analyze --(有材料且需要材料)--> retrieve --(需要练习且无讲解需求)--> practice
 *         --STUDY_PLAN--> plan             \--otherwise--> explain
 *         --PRACTICE--> practice
 *         --EXPLAIN / EXPLAIN_AND_PRACTICE--> explain --(需要练习)--> practice
 *         --otherwise--> respond
 * </pre>
 * plan / practice / respond 之后结束。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Configuration
public class TutorGraphConfiguration {

    public static final String GRAPH_NAME = "tutor";

    public static final String ANALYZE = "analyze";
    public static final String RETRIEVE = "retrieve";
    public static final String EXPLAIN = "explain";
    public static final String PRACTICE = "practice";
    public static final String PLAN = "plan";
    public static final String RESPOND = "respond";

    @Bean
    public NodeRegistry<TutorState> tutorNodeRegistry() {
        return new SpringScanningNodeRegistry<>(TutorState.class);
    }

    @Bean
    @ConditionalOnMissingBean(ContentRepository.class)
    public ContentRepository contentRepository() {
        return new InMemoryContentRepository();
    }

    @Bean
    public AgentGraph<TutorState> tutorGraph(NodeRegistry<TutorState> tutorNodeRegistry) {
        return buildGraph(tutorNodeRegistry);
    }

    /**
     * 构建辅导图。注册表中必须已有全部节点类型。
     */
    public static AgentGraph<TutorState> buildGraph(NodeRegistry<TutorState> registry) {
        return new AgentGraphBuilder<>(GRAPH_NAME, registry)
                .node(ANALYZE, IntentAnalysisNode.TYPE_ID)
                .node(RETRIEVE, ContentRetrievalNode.TYPE_ID)
                .node(EXPLAIN, ExplanationNode.TYPE_ID)
                .node(PRACTICE, PracticeGenerationNode.TYPE_ID)
                .node(PLAN, StudyPlanNode.TYPE_ID)
                .node(RESPOND, GeneralResponseNode.TYPE_ID)
                .entry(ANALYZE)
                .route(ANALYZE)
                    .when((state, decision) -> state.hasContent() && state.getIntent() != null && state.getIntent().usesContent(),
                            RETRIEVE, "needs content")
                    .onDecision(Intent.STUDY_PLAN, PLAN)
                    .onDecision(Intent.PRACTICE, PRACTICE)
                    .onDecision(Intent.EXPLAIN, EXPLAIN)
                    .onDecision(Intent.EXPLAIN_AND_PRACTICE, EXPLAIN)
                    .otherwise(RESPOND)
                .route(RETRIEVE)
                    .when((state, decision) -> state.getIntent() == Intent.PRACTICE, PRACTICE, "practice only")
                    .otherwise(EXPLAIN)
                .route(EXPLAIN)
                    .when((state, decision) -> state.isPracticeRequested(), PRACTICE, "practice requested")
                    .otherwise(AgentGraph.TERMINAL)
                .route(PRACTICE).otherwise(AgentGraph.TERMINAL)
                .route(PLAN).otherwise(AgentGraph.TERMINAL)
                .route(RESPOND).otherwise(AgentGraph.TERMINAL)
                .build();
    }

    @Bean
    public CheckpointStore<TutorState> tutorCheckpointStore(AgentFrameworkProperties properties) {
        AgentFrameworkProperties.Checkpoint checkpoint = properties.getCheckpoint();
        return new CaffeineCheckpointStore<>(checkpoint.getTtl(), checkpoint.getMaxSize());
    }

    @Bean
    public AgentEngine<TutorState> tutorAgentEngine(NodeRegistry<TutorState> tutorNodeRegistry,
                                                    ProviderDispatcher providerDispatcher,
                                                    CheckpointStore<TutorState> tutorCheckpointStore,
                                                    AgentFrameworkProperties properties,
                                                    @Qualifier("agentNodeExecutionScheduler") Scheduler scheduler,
                                                    @Qualifier("agentMonitorListeners") List<AgentMonitorListener> monitorListeners) {
        AgentFrameworkProperties.Engine engine = properties.getEngine();
        StandardNodeExecutor<TutorState> executor = new StandardNodeExecutor<>(tutorNodeRegistry,
                engine.getNodeTimeout(), scheduler, monitorListeners);
        log.info("正在创建辅导图引擎: maxSteps={}, nodeTimeout={}", engine.getMaxSteps(), engine.getNodeTimeout());
        return new StandardAgentEngine<>(executor, providerDispatcher, tutorCheckpointStore, engine.getMaxSteps(), monitorListeners);
    }
}
