package xyz.vvrf.reactor.agent.exception;

import lombok.Getter;
import xyz.vvrf.reactor.agent.dispatch.Capability;
import xyz.vvrf.reactor.agent.dispatch.ProviderCallAttempt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 所有提供方都已失败。携带完整的尝试历史，便于诊断。
 *
 * @author ruifeng.wen
 */
@Getter
public class ProvidersExhaustedException extends AgentException {

    private final Capability capability;
    private final List<ProviderCallAttempt> attempts;

    public ProvidersExhaustedException(Capability capability, List<ProviderCallAttempt> attempts) {
        super(buildMessage(capability, attempts));
        this.capability = capability;
        this.attempts = Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    private static String buildMessage(Capability capability, List<ProviderCallAttempt> attempts) {
        if (attempts.isEmpty()) {
            return String.format("没有可用的提供方 (能力: %s)", capability);
        }
        ProviderCallAttempt last = attempts.get(attempts.size() - 1);
        return String.format("所有提供方均已失败 (能力: %s, 尝试次数: %d, 最后一次: %s/%s %s)",
                capability, attempts.size(), last.getProviderName(), last.getOutcome(),
                last.getErrorMessage() != null ? last.getErrorMessage() : "");
    }
}
