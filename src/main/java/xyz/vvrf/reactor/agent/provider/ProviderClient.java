package xyz.vvrf.reactor.agent.provider;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.CancellationToken;

/**
 * 语言模型提供方客户端。
 * <p>
 * 每次调用都有硬性截止时间；失败以 {@link xyz.vvrf.reactor.agent.exception.ProviderFailureException}
 * 的形式发出，并标记为瞬时或永久。令牌被取消时，调用应放弃并以空信号结束。
 *
 * @author ruifeng.wen
 */
public interface ProviderClient {

    String getName();

    ProviderVariant getVariant();

    /**
     * 未配置凭证等情况下返回 false，调度器会跳过该提供方。
     */
    boolean isEnabled();

    Mono<String> complete(CompletionRequest request, CancellationToken token);

    Flux<String> stream(CompletionRequest request, CancellationToken token);
}
