package xyz.vvrf.reactor.agent.session;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.execution.AgentRun;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 会话并发控制器。保证每个会话同一时刻只有一个可见的运行。
 * <p>
 * 新请求到达时分配新的代数并取代当前运行 (supersede)；被取代的运行继续执行直到注意到取消令牌，
 * 但它的事件会因为代数过期而被传输层过滤掉。每个会话的锁只在代数比较交换期间持有。
 * 代数从 1 开始单调递增，会话存活期间不会回退。
 * 会话状态在最后一次访问后超过存活时间即被遗忘，总数受上限约束。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SessionConcurrencyController {

    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(2);
    public static final long DEFAULT_MAX_SESSIONS = 10_000;

    private final Map<String, SessionState> sessions;

    public SessionConcurrencyController() {
        this(DEFAULT_SESSION_TTL, DEFAULT_MAX_SESSIONS);
    }

    public SessionConcurrencyController(Duration ttl, long maxSessions) {
        this(ttl, maxSessions, Ticker.systemTicker());
    }

    /**
     * @param ticker 过期计时使用的时钟，测试中可替换
     */
    public SessionConcurrencyController(Duration ttl, long maxSessions, Ticker ticker) {
        Objects.requireNonNull(ttl, "会话存活时间不能为空");
        Objects.requireNonNull(ticker, "Ticker 不能为空");
        this.sessions = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxSessions)
                .ticker(ticker)
                .<String, SessionState>removalListener((sessionId, session, cause) -> {
                    if (cause.wasEvicted() && session != null) {
                        log.debug("[Session: {}] 会话状态因 {} 被移除 (最后代数: {})。", sessionId, cause, session.generation);
                    }
                })
                .build()
                .asMap();
    }

    /**
     * 为会话准入一个新运行。
     * 返回的准入结果中包含取消上一个运行的触发器，调用方应立即调用。
     */
    public RunAdmission startRun(String sessionId) {
        Objects.requireNonNull(sessionId, "会话 ID 不能为空");
        SessionState session = sessions.computeIfAbsent(sessionId, SessionState::new);
        CancellationToken token = new CancellationToken();
        long generation;
        long previousGeneration;
        CancellationToken previousToken;

        session.lock.lock();
        try {
            previousGeneration = session.generation;
            previousToken = session.activeToken;
            generation = previousGeneration + 1;
            session.generation = generation;
            session.activeToken = token;
            session.activeRun = null;
            session.lastAdmittedAt = Instant.now();
        } finally {
            session.lock.unlock();
        }

        if (previousToken != null) {
            log.info("[Session: {}] 新运行 (Gen: {}) 取代了运行 (Gen: {})。", sessionId, generation, previousGeneration);
        } else {
            log.debug("[Session: {}] 准入运行 (Gen: {})。", sessionId, generation);
        }
        return new RunAdmission(sessionId, generation, token, previousToken != null ? previousGeneration : 0L, previousToken);
    }

    /**
     * 将运行句柄关联到会话，用于诊断。只有当前代数的运行会被接受。
     */
    public boolean attach(AgentRun run) {
        Objects.requireNonNull(run, "运行句柄不能为空");
        SessionState session = sessions.get(run.getSessionId());
        if (session == null) {
            return false;
        }
        session.lock.lock();
        try {
            if (session.generation != run.getGeneration()) {
                return false;
            }
            session.activeRun = run;
            return true;
        } finally {
            session.lock.unlock();
        }
    }

    /**
     * 给定代数是否仍是会话的当前代数。
     */
    public boolean isCurrent(String sessionId, long generation) {
        SessionState session = sessions.get(sessionId);
        return session != null && session.generation == generation;
    }

    public long currentGeneration(String sessionId) {
        SessionState session = sessions.get(sessionId);
        return session != null ? session.generation : 0L;
    }

    /**
     * 运行结束后释放其活动令牌。只有当前代数的运行才会清除令牌，被取代的运行不影响会话。
     */
    public void release(String sessionId, long generation) {
        SessionState session = sessions.get(sessionId);
        if (session == null) {
            return;
        }
        session.lock.lock();
        try {
            if (session.generation == generation) {
                session.activeToken = null;
            }
        } finally {
            session.lock.unlock();
        }
    }

    /**
     * 客户端显式取消当前运行。
     *
     * @return 是否有运行被取消
     */
    public boolean cancel(String sessionId) {
        SessionState session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        CancellationToken token;
        long generation;
        session.lock.lock();
        try {
            token = session.activeToken;
            generation = session.generation;
        } finally {
            session.lock.unlock();
        }
        if (token != null && token.cancel()) {
            log.info("[Session: {}] 运行 (Gen: {}) 被客户端取消。", sessionId, generation);
            return true;
        }
        return false;
    }

    public Optional<SessionSnapshot> snapshot(String sessionId) {
        SessionState session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        session.lock.lock();
        try {
            AgentRun run = session.activeRun;
            return Optional.of(SessionSnapshot.builder()
                    .sessionId(sessionId)
                    .generation(session.generation)
                    .runStatus(run != null ? run.getStatus() : null)
                    .currentNodeId(run != null ? run.getCurrentNodeId() : null)
                    .stepCount(run != null ? run.getStepCount() : 0)
                    .nodeLog(run != null ? run.getNodeLog() : Collections.<String>emptyList())
                    .lastAdmittedAt(session.lastAdmittedAt)
                    .build());
        } finally {
            session.lock.unlock();
        }
    }

    /**
     * 关闭会话：取消活动运行并忘记该会话。
     *
     * @return 会话是否存在
     */
    public boolean closeSession(String sessionId) {
        SessionState session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        CancellationToken token;
        session.lock.lock();
        try {
            token = session.activeToken;
            session.activeToken = null;
        } finally {
            session.lock.unlock();
        }
        if (token != null) {
            token.cancel();
        }
        log.info("[Session: {}] 会话已关闭 (最后代数: {})。", sessionId, session.generation);
        return true;
    }

    public Set<String> getSessionIds() {
        return Collections.unmodifiableSet(sessions.keySet());
    }

    private static final class SessionState {
        private final String id;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile long generation;
        private CancellationToken activeToken;
        private AgentRun activeRun;
        private Instant lastAdmittedAt;

        private SessionState(String id) {
            this.id = id;
        }

        @Override
        public String toString() {
            return "SessionState{id=" + id + ", generation=" + generation + '}';
        }
    }
}
