package xyz.vvrf.reactor.agent.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.ProviderClient;
import xyz.vvrf.reactor.agent.provider.ProviderErrorClassifier;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;
import xyz.vvrf.reactor.agent.provider.ProviderVariant;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * 基于 {@link WebClient} 的提供方客户端骨架。
 * 负责截止时间、错误分类和取消；子类只关心各自的 HTTP 协议。
 *
 * @author ruifeng.wen
 */
@Slf4j
public abstract class AbstractHttpProviderClient implements ProviderClient {

    private static final int MAX_IN_MEMORY_SIZE = 1024 * 1024;

    protected final ProviderSettings settings;
    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;

    protected AbstractHttpProviderClient(ProviderSettings settings, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        this.settings = Objects.requireNonNull(settings, "提供方配置不能为空");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
        WebClient.Builder builder = Objects.requireNonNull(webClientBuilder, "WebClient.Builder 不能为空").clone()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
        if (settings.getBaseUrl() != null) {
            builder.baseUrl(settings.getBaseUrl());
        }
        this.webClient = builder.build();
        log.info("提供方客户端 '{}' ({}) 已创建。baseUrl: {}, 模型: {}, 超时: {}, 可用: {}",
                settings.getName(), settings.getVariant(), settings.getBaseUrl(), settings.getModel(),
                settings.getTimeout(), isEnabled());
    }

    @Override
    public String getName() {
        return settings.getName();
    }

    @Override
    public ProviderVariant getVariant() {
        return settings.getVariant();
    }

    @Override
    public boolean isEnabled() {
        return settings.isUsable(requiresApiKey());
    }

    @Override
    public final Mono<String> complete(CompletionRequest request, CancellationToken token) {
        Duration deadline = effectiveTimeout(request);
        return Mono.defer(() -> doComplete(request))
                .timeout(deadline)
                .onErrorMap(error -> ProviderErrorClassifier.toFailure(getName(), error))
                .takeUntilOther(token.whenCancelled())
                .doOnCancel(() -> log.debug("提供方 '{}' 的补全调用被取消", getName()));
    }

    /**
     * 截止时间约束整个流，而不是两个片段之间的间隔：持续缓慢输出的提供方同样会在截止时间到达时被切断。
     */
    @Override
    public final Flux<String> stream(CompletionRequest request, CancellationToken token) {
        Duration deadline = effectiveTimeout(request);
        return Flux.defer(() -> {
                    // 所有片段共享同一个截止信号，到期后任何新的等待都立即超时
                    Mono<Long> expiry = Mono.delay(deadline).cache();
                    return doStream(request)
                            .filter(chunk -> !chunk.isEmpty())
                            .timeout(expiry, chunk -> expiry);
                })
                .onErrorMap(error -> ProviderErrorClassifier.toFailure(getName(), error))
                .takeUntilOther(token.whenCancelled());
    }

    protected abstract boolean requiresApiKey();

    protected abstract Mono<String> doComplete(CompletionRequest request);

    protected abstract Flux<String> doStream(CompletionRequest request);

    protected Duration effectiveTimeout(CompletionRequest request) {
        Duration requested = request.getTimeout();
        if (requested != null && !requested.isZero() && !requested.isNegative()) {
            return requested;
        }
        return settings.getTimeout();
    }

    protected ArrayNode messagesNode(CompletionRequest request, boolean includeSystem) {
        ArrayNode messages = objectMapper.createArrayNode();
        if (includeSystem && request.getSystem() != null && !request.getSystem().isEmpty()) {
            messages.add(messageNode(ChatMessage.ROLE_SYSTEM, request.getSystem()));
        }
        for (ChatMessage message : request.getMessages()) {
            messages.add(messageNode(message.getRole(), message.getContent()));
        }
        return messages;
    }

    private ObjectNode messageNode(String role, String content) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", role);
        node.put("content", content);
        return node;
    }

    protected JsonNode readJson(String raw) {
        try {
            return objectMapper.readTree(raw);
        } catch (IOException e) {
            throw new PermanentProviderFailureException(getName(), -1, "无法解析响应: " + e.getMessage(), e);
        }
    }

    protected static String textAt(JsonNode node, String... path) {
        JsonNode current = node;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            current = current.get(segment);
        }
        return (current == null || current.isNull()) ? null : current.asText();
    }
}
