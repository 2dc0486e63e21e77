package xyz.vvrf.reactor.agent.dispatch;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 一次调度的结果：成功 (带值和实际服务的提供方) 或被取消。
 * 取消不是错误；所有提供方失败以 {@link xyz.vvrf.reactor.agent.exception.ProvidersExhaustedException} 表示。
 *
 * @param <T> 值类型
 * @author ruifeng.wen
 */
@Getter
public final class DispatchOutcome<T> {

    private final T value;
    private final String providerName;
    private final boolean cancelled;
    private final boolean fromCache;
    private final List<ProviderCallAttempt> attempts;

    private DispatchOutcome(T value, String providerName, boolean cancelled, boolean fromCache, List<ProviderCallAttempt> attempts) {
        this.value = value;
        this.providerName = providerName;
        this.cancelled = cancelled;
        this.fromCache = fromCache;
        this.attempts = Collections.unmodifiableList(new ArrayList<>(attempts));
    }

    public static <T> DispatchOutcome<T> success(T value, String providerName, List<ProviderCallAttempt> attempts) {
        return new DispatchOutcome<>(value, providerName, false, false, attempts);
    }

    public static <T> DispatchOutcome<T> cached(T value) {
        return new DispatchOutcome<>(value, null, false, true, Collections.emptyList());
    }

    public static <T> DispatchOutcome<T> cancelled(List<ProviderCallAttempt> attempts) {
        return new DispatchOutcome<>(null, null, true, false, attempts);
    }

    public Optional<T> getValueOptional() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return cancelled ? "DispatchOutcome{cancelled, attempts=" + attempts.size() + '}'
                : "DispatchOutcome{provider=" + providerName + ", fromCache=" + fromCache + ", attempts=" + attempts.size() + '}';
    }
}
