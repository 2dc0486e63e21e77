package xyz.vvrf.reactor.agent.exception;

import xyz.vvrf.reactor.agent.provider.FailureKind;

/**
 * 永久失败：鉴权失败、请求非法等。不会重试，直接切换到下一个提供方。
 *
 * @author ruifeng.wen
 */
public class PermanentProviderFailureException extends ProviderFailureException {

    public PermanentProviderFailureException(String providerName, String message) {
        this(providerName, -1, message, null);
    }

    public PermanentProviderFailureException(String providerName, int statusCode, String message, Throwable cause) {
        super(providerName, FailureKind.PERMANENT, statusCode, message, cause);
    }
}
