package xyz.vvrf.reactor.agent.dispatch;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.exception.ProvidersExhaustedException;
import xyz.vvrf.reactor.agent.exception.TransientProviderFailureException;
import xyz.vvrf.reactor.agent.monitor.AgentMonitorListener;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.FailureKind;
import xyz.vvrf.reactor.agent.provider.ProviderClient;
import xyz.vvrf.reactor.agent.provider.ProviderErrorClassifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * {@link ProviderDispatcher} 的标准实现。
 * <p>
 * 按注入列表的顺序依次尝试已启用的提供方；每个提供方最多尝试
 * maxAttempts 次，只有瞬时失败会在指数退避后重试，永久失败立即切换到下一个提供方。
 * 退避等待使用注入的 {@link Scheduler}，测试中可以替换为虚拟时间。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class RetryingProviderDispatcher implements ProviderDispatcher {

    private final List<ProviderClient> providers;
    private final DispatcherSettings settings;
    private final BackoffPolicy backoffPolicy;
    private final Scheduler timerScheduler;
    private final CompletionCache completionCache;
    private final List<AgentMonitorListener> monitorListeners;

    public RetryingProviderDispatcher(List<ProviderClient> providers, DispatcherSettings settings) {
        this(providers, settings, BackoffPolicy.from(settings), Schedulers.parallel(), null, Collections.emptyList());
    }

    public RetryingProviderDispatcher(List<ProviderClient> providers,
                                      DispatcherSettings settings,
                                      BackoffPolicy backoffPolicy,
                                      Scheduler timerScheduler,
                                      CompletionCache completionCache,
                                      List<AgentMonitorListener> monitorListeners) {
        Objects.requireNonNull(providers, "提供方列表不能为空");
        this.settings = Objects.requireNonNull(settings, "调度器配置不能为空");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "退避策略不能为空");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "计时调度器不能为空");
        if (settings.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts 必须 >= 1，实际为 " + settings.getMaxAttempts());
        }
        this.providers = Collections.unmodifiableList(new ArrayList<>(providers));
        this.completionCache = completionCache;
        this.monitorListeners = (monitorListeners != null) ? Collections.unmodifiableList(new ArrayList<>(monitorListeners)) : Collections.emptyList();
        log.info("RetryingProviderDispatcher 已初始化。提供方: {}, maxAttempts: {}, baseDelay: {}, maxDelay: {}, jitter: {}, 缓存: {}",
                this.providers.stream().map(p -> p.getName() + "(" + p.getVariant() + (p.isEnabled() ? "" : ", 已禁用") + ")")
                        .collect(Collectors.joining(", ")),
                settings.getMaxAttempts(), settings.getBaseDelay(), settings.getMaxDelay(), settings.getJitterFactor(),
                completionCache != null ? "启用" : "禁用");
    }

    @Override
    public Mono<DispatchOutcome<String>> complete(CompletionRequest request, CancellationToken token) {
        Objects.requireNonNull(request, "请求不能为空");
        Objects.requireNonNull(token, "取消令牌不能为空");
        return Mono.defer(() -> {
            if (token.isCancelled()) {
                return Mono.just(DispatchOutcome.<String>cancelled(Collections.emptyList()));
            }
            if (completionCache != null && request.isCacheable()) {
                String hit = completionCache.get(request).orElse(null);
                if (hit != null) {
                    log.debug("补全缓存命中，跳过提供方调用");
                    return Mono.just(DispatchOutcome.cached(hit));
                }
            }
            List<ProviderCallAttempt> history = new CopyOnWriteArrayList<>();
            List<ProviderClient> candidates = candidates(request);

            return Flux.fromIterable(candidates)
                    .concatMap(provider -> completeWithRetry(provider, request, token, history))
                    .next()
                    .switchIfEmpty(Mono.defer(() -> token.isCancelled()
                            ? Mono.<DispatchOutcome<String>>empty()
                            : Mono.error(exhausted(Capability.COMPLETE, history))))
                    .doOnNext(outcome -> {
                        if (completionCache != null && request.isCacheable()) {
                            completionCache.put(request, outcome.getValue());
                        }
                    })
                    .takeUntilOther(token.whenCancelled())
                    .switchIfEmpty(Mono.fromSupplier(() -> {
                        log.debug("补全调度被取消。已有尝试: {}", history.size());
                        return DispatchOutcome.<String>cancelled(history);
                    }));
        });
    }

    @Override
    public Flux<String> stream(CompletionRequest request, CancellationToken token) {
        Objects.requireNonNull(request, "请求不能为空");
        Objects.requireNonNull(token, "取消令牌不能为空");
        return Flux.defer(() -> {
            if (token.isCancelled()) {
                return Flux.<String>empty();
            }
            List<ProviderCallAttempt> history = new CopyOnWriteArrayList<>();
            AtomicBoolean delivered = new AtomicBoolean(false);
            return streamFrom(candidates(request), 0, request, token, history, delivered);
        }).takeUntilOther(token.whenCancelled());
    }

    private Mono<DispatchOutcome<String>> completeWithRetry(ProviderClient provider,
                                                            CompletionRequest request,
                                                            CancellationToken token,
                                                            List<ProviderCallAttempt> history) {
        AttemptTracker tracker = new AttemptTracker(provider, Capability.COMPLETE, history);
        return Mono.defer(() -> {
                    if (token.isCancelled()) {
                        return Mono.<String>empty();
                    }
                    long start = tracker.begin();
                    return provider.complete(request, token)
                            .switchIfEmpty(Mono.defer(() -> token.isCancelled()
                                    ? Mono.<String>empty()
                                    : Mono.error(new TransientProviderFailureException(provider.getName(), "提供方返回了空响应"))))
                            .doOnNext(value -> tracker.succeeded(start))
                            .doOnError(error -> tracker.failed(start, error));
                })
                .retryWhen(retrySpec(tracker, () -> false))
                .map(value -> DispatchOutcome.success(value, provider.getName(), history))
                .onErrorResume(error -> {
                    log.warn("提供方 '{}' ({}) 放弃，尝试下一个。原因: {}",
                            provider.getName(), provider.getVariant(), error.getMessage());
                    return Mono.empty();
                });
    }

    private Flux<String> streamFrom(List<ProviderClient> candidates,
                                    int index,
                                    CompletionRequest request,
                                    CancellationToken token,
                                    List<ProviderCallAttempt> history,
                                    AtomicBoolean delivered) {
        if (index >= candidates.size()) {
            return Flux.defer(() -> token.isCancelled()
                    ? Flux.<String>empty()
                    : Flux.<String>error(exhausted(Capability.STREAM, history)));
        }
        ProviderClient provider = candidates.get(index);
        AttemptTracker tracker = new AttemptTracker(provider, Capability.STREAM, history);
        return Flux.defer(() -> {
                    if (token.isCancelled()) {
                        return Flux.<String>empty();
                    }
                    long start = tracker.begin();
                    return provider.stream(request, token)
                            .doOnNext(chunk -> delivered.set(true))
                            .doOnComplete(() -> {
                                if (!token.isCancelled()) {
                                    tracker.succeeded(start);
                                }
                            })
                            .doOnError(error -> tracker.failed(start, error));
                })
                // 已经输出过片段后不能重试，否则客户端会看到重复内容
                .retryWhen(retrySpec(tracker, delivered::get))
                .onErrorResume(error -> !delivered.get(), error -> {
                    log.warn("提供方 '{}' ({}) 流式调用放弃，尝试下一个。原因: {}",
                            provider.getName(), provider.getVariant(), error.getMessage());
                    return streamFrom(candidates, index + 1, request, token, history, delivered);
                });
    }

    private Retry retrySpec(AttemptTracker tracker, BooleanSupplier abort) {
        return Retry.from(signals -> signals
                .map(Retry.RetrySignal::copy)
                .concatMap(signal -> {
                    Throwable failure = signal.failure();
                    long attemptsSoFar = signal.totalRetries() + 1;
                    if (ProviderErrorClassifier.classify(failure) != FailureKind.TRANSIENT
                            || attemptsSoFar >= settings.getMaxAttempts()
                            || abort.getAsBoolean()) {
                        return Mono.<Long>error(failure);
                    }
                    Duration delay = backoffPolicy.delayFor((int) attemptsSoFar);
                    tracker.scheduleBackoff(delay);
                    log.debug("提供方 '{}' 瞬时失败，{}ms 后进行第 {} 次尝试。原因: {}",
                            tracker.provider.getName(), delay.toMillis(), attemptsSoFar + 1, failure.getMessage());
                    return Mono.delay(delay, timerScheduler);
                }));
    }

    private List<ProviderClient> candidates(CompletionRequest request) {
        List<ProviderClient> enabled = new ArrayList<>();
        for (ProviderClient provider : providers) {
            if (provider.isEnabled()) {
                enabled.add(provider);
            } else {
                log.trace("提供方 '{}' 未启用，跳过。", provider.getName());
            }
        }
        String preferred = request.getPreferredProvider();
        if (preferred != null) {
            for (int i = 0; i < enabled.size(); i++) {
                if (preferred.equals(enabled.get(i).getName())) {
                    enabled.add(0, enabled.remove(i));
                    break;
                }
            }
        }
        return enabled;
    }

    private ProvidersExhaustedException exhausted(Capability capability, List<ProviderCallAttempt> history) {
        ProvidersExhaustedException exception = new ProvidersExhaustedException(capability, history);
        log.error("{} 尝试历史: {}", exception.getMessage(), history);
        return exception;
    }

    private void safeNotifyListeners(Consumer<AgentMonitorListener> action) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (AgentMonitorListener listener : monitorListeners) {
            try {
                action.accept(listener);
            } catch (Exception e) {
                log.error("调用监控监听器 {} 时出错: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * 记录某个提供方上的尝试序号、退避和结果。每次 complete/stream 调用对每个提供方新建一个。
     */
    private final class AttemptTracker {

        private final ProviderClient provider;
        private final Capability capability;
        private final List<ProviderCallAttempt> history;
        private int attemptNumber;
        private Duration pendingBackoff = Duration.ZERO;

        private AttemptTracker(ProviderClient provider, Capability capability, List<ProviderCallAttempt> history) {
            this.provider = provider;
            this.capability = capability;
            this.history = history;
        }

        synchronized long begin() {
            attemptNumber++;
            return timerScheduler.now(TimeUnit.MILLISECONDS);
        }

        synchronized void scheduleBackoff(Duration delay) {
            this.pendingBackoff = delay;
        }

        void succeeded(long startMillis) {
            record(AttemptOutcome.SUCCESS, startMillis, null);
        }

        void failed(long startMillis, Throwable error) {
            AttemptOutcome outcome;
            if (isTimeout(error)) {
                outcome = AttemptOutcome.TIMEOUT;
            } else if (ProviderErrorClassifier.classify(error) == FailureKind.TRANSIENT) {
                outcome = AttemptOutcome.TRANSIENT_ERROR;
            } else {
                outcome = AttemptOutcome.PERMANENT_ERROR;
            }
            record(outcome, startMillis, error.getMessage());
        }

        private synchronized void record(AttemptOutcome outcome, long startMillis, String errorMessage) {
            ProviderCallAttempt attempt = ProviderCallAttempt.builder()
                    .providerName(provider.getName())
                    .variant(provider.getVariant())
                    .capability(capability)
                    .attemptNumber(attemptNumber)
                    .outcome(outcome)
                    .latency(Duration.ofMillis(Math.max(0, timerScheduler.now(TimeUnit.MILLISECONDS) - startMillis)))
                    .backoffDelay(pendingBackoff)
                    .errorMessage(errorMessage)
                    .build();
            pendingBackoff = Duration.ZERO;
            history.add(attempt);
            safeNotifyListeners(l -> l.onProviderAttempt(attempt));
        }

        private boolean isTimeout(Throwable error) {
            Throwable current = error;
            while (current != null) {
                if (current instanceof TimeoutException) {
                    return true;
                }
                if (current.getCause() == current) {
                    break;
                }
                current = current.getCause();
            }
            return false;
        }
    }
}
