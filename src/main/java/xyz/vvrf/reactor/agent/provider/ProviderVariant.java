package xyz.vvrf.reactor.agent.provider;

/**
 * 提供方变体。调度器默认按 PRIMARY -> FALLBACK -> LOCAL 的顺序尝试。
 *
 * @author ruifeng.wen
 */
public enum ProviderVariant {
    PRIMARY,
    FALLBACK,
    LOCAL
}
