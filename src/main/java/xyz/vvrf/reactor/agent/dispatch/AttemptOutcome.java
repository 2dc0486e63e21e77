package xyz.vvrf.reactor.agent.dispatch;

/**
 * 单次提供方调用的结果。
 *
 * @author ruifeng.wen
 */
public enum AttemptOutcome {
    SUCCESS,
    TIMEOUT,
    TRANSIENT_ERROR,
    PERMANENT_ERROR
}
