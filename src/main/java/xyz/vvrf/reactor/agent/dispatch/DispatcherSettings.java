package xyz.vvrf.reactor.agent.dispatch;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 调度器的重试配置，构造时注入。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class DispatcherSettings {

    /**
     * 每个提供方的最大尝试次数 (包括第一次)。
     */
    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofMillis(500);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(8);

    /**
     * 抖动比例，取值 [0, 0.2]。
     */
    @Builder.Default
    double jitterFactor = 0.2;
}
