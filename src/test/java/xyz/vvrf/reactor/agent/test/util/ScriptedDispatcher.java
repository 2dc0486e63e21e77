package xyz.vvrf.reactor.agent.test.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.dispatch.DispatchOutcome;
import xyz.vvrf.reactor.agent.dispatch.ProviderDispatcher;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 直接返回预设内容的调度器，用于节点和引擎测试。
 */
public class ScriptedDispatcher implements ProviderDispatcher {

    private Function<CompletionRequest, Mono<String>> completion = request -> Mono.just("GENERAL");
    private Function<CompletionRequest, Flux<String>> stream = request -> Flux.just("ok");
    private final List<CompletionRequest> requests = Collections.synchronizedList(new ArrayList<>());

    public ScriptedDispatcher completes(Function<CompletionRequest, Mono<String>> completion) {
        this.completion = completion;
        return this;
    }

    public ScriptedDispatcher streams(Function<CompletionRequest, Flux<String>> stream) {
        this.stream = stream;
        return this;
    }

    public List<CompletionRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    @Override
    public Mono<DispatchOutcome<String>> complete(CompletionRequest request, CancellationToken token) {
        requests.add(request);
        if (token.isCancelled()) {
            return Mono.just(DispatchOutcome.<String>cancelled(Collections.emptyList()));
        }
        return completion.apply(request)
                .map(value -> DispatchOutcome.success(value, "scripted", Collections.emptyList()));
    }

    @Override
    public Flux<String> stream(CompletionRequest request, CancellationToken token) {
        requests.add(request);
        return stream.apply(request).takeUntilOther(token.whenCancelled());
    }
}
