package xyz.vvrf.reactor.agent.core;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一次运行的协作式取消令牌。
 * <p>
 * 令牌只能从未取消变为已取消，且不可逆。所有可能挂起的调用 (提供方调用、退避等待、节点执行)
 * 都应接收令牌，并在 {@link #whenCancelled()} 发出信号时尽快放弃当前工作。
 *
 * @author ruifeng.wen
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> signal = Sinks.one();

    /**
     * 触发取消。
     *
     * @return 如果本次调用完成了取消返回 true；已经取消过返回 false
     */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 取消时发出一个值的 Mono。取消之后订阅也会立即收到该值。
     * 适合作为 {@code takeUntilOther} 的伴随发布者。
     */
    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + '}';
    }
}
