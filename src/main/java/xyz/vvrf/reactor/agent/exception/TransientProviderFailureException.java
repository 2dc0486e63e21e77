package xyz.vvrf.reactor.agent.exception;

import xyz.vvrf.reactor.agent.provider.FailureKind;

/**
 * 瞬时失败：超时、限流、服务端 5xx、连接中断。可以重试。
 *
 * @author ruifeng.wen
 */
public class TransientProviderFailureException extends ProviderFailureException {

    public TransientProviderFailureException(String providerName, String message) {
        this(providerName, -1, message, null);
    }

    public TransientProviderFailureException(String providerName, int statusCode, String message, Throwable cause) {
        super(providerName, FailureKind.TRANSIENT, statusCode, message, cause);
    }
}
