package xyz.vvrf.reactor.agent.dispatch;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;

/**
 * 带重试和降级的提供方调度器。在所有运行之间共享，只读。
 *
 * @author ruifeng.wen
 */
public interface ProviderDispatcher {

    /**
     * 非流式补全。
     *
     * @return 成功或取消的结果；所有提供方失败时以
     *         {@link xyz.vvrf.reactor.agent.exception.ProvidersExhaustedException} 结束
     */
    Mono<DispatchOutcome<String>> complete(CompletionRequest request, CancellationToken token);

    /**
     * 流式补全。只有在尚未输出任何片段时才会重试或切换提供方。
     * 令牌取消时流静默结束。
     */
    Flux<String> stream(CompletionRequest request, CancellationToken token);
}
