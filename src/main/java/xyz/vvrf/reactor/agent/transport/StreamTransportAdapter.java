package xyz.vvrf.reactor.agent.transport;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.agent.core.RunStatus;
import xyz.vvrf.reactor.agent.core.StreamEvent;
import xyz.vvrf.reactor.agent.execution.AgentRun;
import xyz.vvrf.reactor.agent.session.SessionConcurrencyController;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 流传输适配器。把运行的事件流转换为客户端可消费的有序序列。
 * <p>
 * 每个运行在 {@link #open} 时被立即订阅 (在运行调度器上)，事件写入该运行自己的重放缓冲区，
 * 并作为"最新运行"发布到会话通道。投递时按会话的当前代数过滤过期事件，
 * 同一代数内只投递严格递增的序号，遇到终态事件关闭序列。
 * 会话通道在最后一次访问后超过存活时间即被关闭并移除。
 * 准入调用方的序列在运行被取代时以一个 done(cancelled) 帧结束；会话订阅者看不到这个帧，它们直接切换到新运行。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class StreamTransportAdapter {

    private final SessionConcurrencyController controller;
    private final Scheduler scheduler;
    private final Map<String, SessionChannel> channels;

    public StreamTransportAdapter(SessionConcurrencyController controller, Scheduler scheduler) {
        this(controller, scheduler, SessionConcurrencyController.DEFAULT_SESSION_TTL,
                SessionConcurrencyController.DEFAULT_MAX_SESSIONS);
    }

    public StreamTransportAdapter(SessionConcurrencyController controller, Scheduler scheduler,
                                  Duration ttl, long maxSessions) {
        this(controller, scheduler, ttl, maxSessions, Ticker.systemTicker());
    }

    public StreamTransportAdapter(SessionConcurrencyController controller, Scheduler scheduler,
                                  Duration ttl, long maxSessions, Ticker ticker) {
        this.controller = Objects.requireNonNull(controller, "SessionConcurrencyController 不能为空");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler 不能为空");
        Objects.requireNonNull(ttl, "会话存活时间不能为空");
        Objects.requireNonNull(ticker, "Ticker 不能为空");
        this.channels = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxSessions)
                .ticker(ticker)
                .<String, SessionChannel>removalListener((sessionId, channel, cause) -> {
                    // 显式关闭由 closeSession 处理
                    if (cause.wasEvicted() && channel != null) {
                        channel.close();
                        log.debug("[Session: {}] 会话事件通道因 {} 被关闭。", sessionId, cause);
                    }
                })
                .build()
                .asMap();
    }

    /**
     * 启动运行并返回调用方的订阅句柄。运行立即开始，不依赖调用方何时订阅。
     */
    public RunSubscription open(AgentRun run, Flux<StreamEvent> runEvents) {
        Objects.requireNonNull(run, "运行句柄不能为空");
        Objects.requireNonNull(runEvents, "运行事件流不能为空");

        RunChannel runChannel = new RunChannel(run);
        channelFor(run.getSessionId()).publish(runChannel);
        runChannel.connect(runEvents.subscribeOn(scheduler));
        log.debug("[Session: {}][Gen: {}] 运行事件流已打开。", run.getSessionId(), run.getGeneration());
        return runChannel;
    }

    /**
     * 订阅会话的事件序列：从会话最新运行的第一个事件开始，跟随之后被准入的运行，
     * 在当前运行的终态事件处关闭。订阅者断开不会取消运行。
     */
    public Flux<StreamEvent> subscribe(String sessionId) {
        Objects.requireNonNull(sessionId, "会话 ID 不能为空");
        return Flux.defer(() -> {
            Predicate<StreamEvent> inOrder = new OrderGuard();
            return channelFor(sessionId).runs()
                    .switchMap(RunChannel::replay)
                    .filter(event -> controller.isCurrent(sessionId, event.getGeneration()))
                    .filter(inOrder)
                    .takeUntil(StreamEvent::isTerminal);
        });
    }

    /**
     * 结束会话通道。已经打开的订阅在当前运行结束后完成。
     */
    public void closeSession(String sessionId) {
        SessionChannel channel = channels.remove(sessionId);
        if (channel != null) {
            channel.close();
            log.debug("[Session: {}] 会话事件通道已关闭。", sessionId);
        }
    }

    private SessionChannel channelFor(String sessionId) {
        return channels.computeIfAbsent(sessionId, SessionChannel::new);
    }

    /**
     * 同一代数内只放行严格递增的序号；更新的代数重置计数，更旧的代数直接丢弃。
     */
    private static final class OrderGuard implements Predicate<StreamEvent> {
        private long generation = -1;
        private long lastSequence = -1;

        @Override
        public synchronized boolean test(StreamEvent event) {
            if (event.getGeneration() < generation) {
                return false;
            }
            if (event.getGeneration() > generation) {
                generation = event.getGeneration();
                lastSequence = -1;
            }
            if (event.getSequence() <= lastSequence) {
                return false;
            }
            lastSequence = event.getSequence();
            return true;
        }
    }

    /**
     * 会话级通道，只保留最新被打开的运行。
     */
    private static final class SessionChannel {
        private final String sessionId;
        private final Sinks.Many<RunChannel> latest = Sinks.many().replay().latest();
        private long publishedGeneration;

        private SessionChannel(String sessionId) {
            this.sessionId = sessionId;
        }

        synchronized void publish(RunChannel channel) {
            long generation = channel.getGeneration();
            if (generation <= publishedGeneration) {
                // 并发准入时更新的代数可能先到达
                log.debug("[Session: {}] 代数 {} 已被 {} 取代，不再发布到会话通道。", sessionId, generation, publishedGeneration);
                return;
            }
            publishedGeneration = generation;
            Sinks.EmitResult result = latest.tryEmitNext(channel);
            if (result.isFailure()) {
                log.warn("[Session: {}] 发布运行 (Gen: {}) 到会话通道失败: {}", sessionId, generation, result);
            }
        }

        Flux<RunChannel> runs() {
            return latest.asFlux();
        }

        synchronized void close() {
            latest.tryEmitComplete();
        }
    }

    /**
     * 单个运行的事件缓冲区和调用方视图。
     */
    private final class RunChannel implements RunSubscription {
        private final AgentRun run;
        private final Sinks.Many<StreamEvent> buffer = Sinks.many().replay().all();

        private RunChannel(AgentRun run) {
            this.run = run;
        }

        void connect(Flux<StreamEvent> runEvents) {
            runEvents.subscribe(
                    this::onEvent,
                    error -> {
                        log.error("[Session: {}][Gen: {}] 运行事件流异常终止: {}",
                                run.getSessionId(), run.getGeneration(), error.getMessage(), error);
                        buffer.tryEmitError(error);
                    },
                    buffer::tryEmitComplete);
        }

        private void onEvent(StreamEvent event) {
            Sinks.EmitResult result = buffer.tryEmitNext(event);
            if (result.isFailure()) {
                log.warn("[Session: {}][Gen: {}] 缓存事件 {} 失败: {}", run.getSessionId(), run.getGeneration(), event, result);
            }
        }

        Flux<StreamEvent> replay() {
            return buffer.asFlux();
        }

        @Override
        public AgentRun getRun() {
            return run;
        }

        @Override
        public Flux<StreamEvent> events() {
            String sessionId = run.getSessionId();
            return Flux.defer(() -> {
                Predicate<StreamEvent> inOrder = new OrderGuard();
                return buffer.asFlux()
                        .filter(inOrder)
                        .map(event -> controller.isCurrent(sessionId, event.getGeneration()) ? event : superseded(event))
                        .takeUntil(StreamEvent::isTerminal)
                        .doOnCancel(() -> {
                            if (run.cancel()) {
                                log.info("[Session: {}][Gen: {}] 客户端断开连接，运行已取消。", sessionId, run.getGeneration());
                            }
                        });
            });
        }

        @Override
        public boolean cancel() {
            return run.cancel();
        }

        /**
         * 第一个过期事件被替换为本代数的 done(cancelled)，沿用该事件的序号，序列随之关闭。
         */
        private StreamEvent superseded(StreamEvent staleEvent) {
            log.debug("[Session: {}][Gen: {}] 运行已被取代，以 done(cancelled) 结束调用方的事件序列。",
                    run.getSessionId(), run.getGeneration());
            return StreamEvent.done(run.getGeneration(), staleEvent.getSequence(), RunStatus.CANCELLED);
        }
    }
}
