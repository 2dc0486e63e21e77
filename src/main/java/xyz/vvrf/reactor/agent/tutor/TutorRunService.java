package xyz.vvrf.reactor.agent.tutor;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import xyz.vvrf.reactor.agent.checkpoint.CheckpointStore;
import xyz.vvrf.reactor.agent.checkpoint.RunCheckpoint;
import xyz.vvrf.reactor.agent.core.AgentGraph;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.core.StreamEvent;
import xyz.vvrf.reactor.agent.execution.AgentEngine;
import xyz.vvrf.reactor.agent.execution.AgentRun;
import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.session.RunAdmission;
import xyz.vvrf.reactor.agent.session.SessionConcurrencyController;
import xyz.vvrf.reactor.agent.session.SessionSnapshot;
import xyz.vvrf.reactor.agent.spring.boot.AgentFrameworkProperties;
import xyz.vvrf.reactor.agent.transport.RunSubscription;
import xyz.vvrf.reactor.agent.transport.StreamTransportAdapter;

import java.util.Objects;
import java.util.Optional;

/**
 * 辅导运行的入口：准入 (取代旧运行) -> 构造初始状态 -> 启动引擎 -> 交给传输层。
 * <p>
 * 会话的对话记录只在运行以 COMPLETED 结束且仍是当前代数时追加助手回复，
 * 被取消或被取代的运行不会留下任何产物。
 *
 * @author ruifeng.wen
 */
@Slf4j
@Service
public class TutorRunService {

    private final AgentEngine<TutorState> engine;
    private final AgentGraph<TutorState> graph;
    private final SessionConcurrencyController sessionController;
    private final StreamTransportAdapter transport;
    private final CheckpointStore<TutorState> checkpointStore;
    private final Cache<String, TutorSession> sessions;

    public TutorRunService(AgentEngine<TutorState> engine,
                           AgentGraph<TutorState> graph,
                           SessionConcurrencyController sessionController,
                           StreamTransportAdapter transport,
                           CheckpointStore<TutorState> checkpointStore,
                           AgentFrameworkProperties properties) {
        this.engine = Objects.requireNonNull(engine, "AgentEngine 不能为空");
        this.graph = Objects.requireNonNull(graph, "AgentGraph 不能为空");
        this.sessionController = Objects.requireNonNull(sessionController, "SessionConcurrencyController 不能为空");
        this.transport = Objects.requireNonNull(transport, "StreamTransportAdapter 不能为空");
        this.checkpointStore = Objects.requireNonNull(checkpointStore, "CheckpointStore 不能为空");
        AgentFrameworkProperties.Session session = properties.getSession();
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(session.getTtl())
                .maximumSize(session.getMaxSessions())
                .build();
    }

    /**
     * 准入一个新运行。会话中正在进行的运行被取代并取消。
     */
    public RunSubscription startRun(TutorTurn turn) {
        Objects.requireNonNull(turn, "请求不能为空");
        String sessionId = Objects.requireNonNull(turn.getSessionId(), "会话 ID 不能为空");

        RunAdmission admission = sessionController.startRun(sessionId);
        if (admission.cancelPrevious()) {
            log.info("[Session: {}] 已取消被取代的运行 (Gen: {})。", sessionId, admission.getSupersededGeneration());
        }
        checkpointStore.discard(sessionId, admission.getSupersededGeneration());

        long generation = admission.getGeneration();
        AgentRun run = new AgentRun(sessionId, generation, null, admission.getToken());
        sessionController.attach(run);

        TutorState initialState = initialState(turn, session(sessionId));
        Flux<StreamEvent> events = engine.execute(run, initialState, graph)
                .doOnNext(event -> {
                    if (event.isTerminal() && event.getStatus() == RunStatus.COMPLETED) {
                        recordResponse(sessionId, generation);
                    }
                })
                .doFinally(signal -> sessionController.release(sessionId, generation));
        return transport.open(run, events);
    }

    private TutorState initialState(TutorTurn turn, TutorSession session) {
        ConversationLog conversation = session.getConversation();
        // 服务端还没有记录时，用客户端携带的历史初始化
        if (conversation.size() == 0 && turn.getHistory() != null) {
            for (ChatMessage message : turn.getHistory()) {
                conversation.append(message);
            }
        }
        int turnIndex = conversation.append(ChatMessage.user(turn.getMessage()));
        return TutorState.builder()
                .sessionId(turn.getSessionId())
                .conversation(conversation)
                .turnIndex(turnIndex)
                .userMessage(turn.getMessage())
                .contentIds(turn.getContentIds())
                .requestedAction(turn.getAction())
                .difficulty(session.getDifficulty())
                .build();
    }

    private void recordResponse(String sessionId, long generation) {
        if (!sessionController.isCurrent(sessionId, generation)) {
            return;
        }
        Optional<RunCheckpoint<TutorState>> checkpoint = checkpointStore.load(sessionId);
        if (!checkpoint.isPresent() || checkpoint.get().getGeneration() != generation) {
            log.warn("[Session: {}][Gen: {}] 运行已完成但找不到对应的检查点，回复未写入对话记录。", sessionId, generation);
            return;
        }
        String response = checkpoint.get().getState().getResponse();
        if (response != null && !response.isEmpty()) {
            session(sessionId).getConversation().append(ChatMessage.assistant(response));
        }
    }

    public boolean cancel(String sessionId) {
        return sessionController.cancel(sessionId);
    }

    public Flux<StreamEvent> subscribe(String sessionId) {
        return transport.subscribe(sessionId);
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        return sessionController.snapshot(sessionId);
    }

    /**
     * 关闭会话：取消活动运行，丢弃检查点、对话记录和难度。
     */
    public boolean closeSession(String sessionId) {
        boolean existed = sessionController.closeSession(sessionId);
        transport.closeSession(sessionId);
        checkpointStore.clear(sessionId);
        sessions.invalidate(sessionId);
        return existed;
    }

    /**
     * 根据表现得分调整会话难度，对之后的运行生效。
     */
    public DifficultyLevel adaptDifficulty(String sessionId, double score) {
        TutorSession session = session(sessionId);
        DifficultyLevel before = session.getDifficulty();
        DifficultyLevel after = session.adapt(score);
        if (before != after) {
            log.info("[Session: {}] 难度调整: {} -> {} (得分: {})", sessionId, before, after, score);
        }
        return after;
    }

    public DifficultyLevel currentDifficulty(String sessionId) {
        TutorSession session = sessions.getIfPresent(sessionId);
        return session != null ? session.getDifficulty() : DifficultyLevel.INTERMEDIATE;
    }

    public String graphDot() {
        return graph.getDotRepresentation();
    }

    private TutorSession session(String sessionId) {
        return sessions.get(sessionId, id -> new TutorSession());
    }
}
