package xyz.vvrf.reactor.agent.dispatch;

/**
 * 调度器对外提供的能力。
 *
 * @author ruifeng.wen
 */
public enum Capability {
    COMPLETE,
    STREAM
}
