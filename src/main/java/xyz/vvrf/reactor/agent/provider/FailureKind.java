package xyz.vvrf.reactor.agent.provider;

/**
 * 提供方失败的分类。
 *
 * @author ruifeng.wen
 */
public enum FailureKind {
    /**
     * 超时、限流、5xx、连接错误，可重试。
     */
    TRANSIENT,
    /**
     * 鉴权失败、请求非法等，不重试。
     */
    PERMANENT
}
