package xyz.vvrf.reactor.agent.dispatch;

import lombok.Builder;
import lombok.Value;
import xyz.vvrf.reactor.agent.provider.ProviderVariant;

import java.time.Duration;

/**
 * 一次提供方调用的记录，用于诊断和监控。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class ProviderCallAttempt {

    String providerName;
    ProviderVariant variant;
    Capability capability;
    /**
     * 在该提供方上的第几次尝试，从 1 开始。
     */
    int attemptNumber;
    AttemptOutcome outcome;
    Duration latency;
    /**
     * 本次尝试之前的退避等待，第一次尝试为 0。
     */
    Duration backoffDelay;
    String errorMessage;
}
