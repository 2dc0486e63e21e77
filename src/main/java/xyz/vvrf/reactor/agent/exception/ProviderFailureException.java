package xyz.vvrf.reactor.agent.exception;

import lombok.Getter;
import xyz.vvrf.reactor.agent.provider.FailureKind;

/**
 * 一次提供方调用失败。按 {@link FailureKind} 区分是否值得重试。
 *
 * @author ruifeng.wen
 */
@Getter
public abstract class ProviderFailureException extends AgentException {

    private final String providerName;
    private final FailureKind kind;
    /**
     * HTTP 状态码，没有时为 -1。
     */
    private final int statusCode;

    protected ProviderFailureException(String providerName, FailureKind kind, int statusCode, String message, Throwable cause) {
        super(String.format("提供方 '%s' 调用失败 (%s%s): %s", providerName, kind,
                statusCode > 0 ? ", HTTP " + statusCode : "", message), cause);
        this.providerName = providerName;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public boolean isTransient() {
        return kind == FailureKind.TRANSIENT;
    }
}
