package xyz.vvrf.reactor.agent.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 带抖动的指数退避。
 * <p>
 * 第 n 次重试 (n >= 1) 前的等待为 {@code min(base * 2^(n-1), max)}，再向下减去至多 jitterFactor 比例的随机抖动，
 * 因此等待时间落在 {@code [d * (1 - jitter), d]} 区间内，并且永远不超过 max。
 *
 * @author ruifeng.wen
 */
public final class BackoffPolicy {

    public static final double MAX_JITTER_FACTOR = 0.2;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "基础退避时间不能为空");
        this.maxDelay = Objects.requireNonNull(maxDelay, "最大退避时间不能为空");
        this.random = Objects.requireNonNull(random, "随机数来源不能为空");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("退避时间不能为负数");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(String.format("最大退避时间 %s 不能小于基础退避时间 %s", maxDelay, baseDelay));
        }
        if (jitterFactor < 0 || jitterFactor > MAX_JITTER_FACTOR) {
            throw new IllegalArgumentException(String.format("抖动比例必须在 [0, %s] 之间，实际为 %s", MAX_JITTER_FACTOR, jitterFactor));
        }
        this.jitterFactor = jitterFactor;
    }

    public static BackoffPolicy from(DispatcherSettings settings) {
        return new BackoffPolicy(settings.getBaseDelay(), settings.getMaxDelay(), settings.getJitterFactor());
    }

    /**
     * 不含抖动的退避时间。
     *
     * @param retryNumber 第几次重试，从 1 开始
     */
    public Duration nominalDelay(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("重试序号从 1 开始: " + retryNumber);
        }
        long baseMillis = baseDelay.toMillis();
        long maxMillis = maxDelay.toMillis();
        // 指数超过 62 位时直接取上限
        int shift = Math.min(retryNumber - 1, 62);
        long exponential = (baseMillis > 0 && baseMillis > (Long.MAX_VALUE >> shift)) ? Long.MAX_VALUE : baseMillis << shift;
        return Duration.ofMillis(Math.min(exponential, maxMillis));
    }

    public Duration delayFor(int retryNumber) {
        Duration nominal = nominalDelay(retryNumber);
        if (jitterFactor == 0) {
            return nominal;
        }
        double r = Math.max(0.0, Math.min(1.0, random.getAsDouble()));
        long jitterMillis = (long) (nominal.toMillis() * jitterFactor * r);
        return nominal.minusMillis(jitterMillis);
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
