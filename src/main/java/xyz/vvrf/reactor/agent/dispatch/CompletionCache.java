package xyz.vvrf.reactor.agent.dispatch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 非流式补全结果的缓存。只缓存标记为 cacheable 的请求。
 * 键由系统提示词、消息、温度和 maxTokens 的 SHA-256 摘要组成，与提供方无关。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class CompletionCache {

    private final Cache<String, String> cache;

    public CompletionCache(Duration ttl, long maximumSize) {
        Objects.requireNonNull(ttl, "缓存 TTL 不能为空");
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
        log.info("补全缓存已创建。TTL: {}, 最大条目数: {}", ttl, maximumSize);
    }

    public Optional<String> get(CompletionRequest request) {
        return Optional.ofNullable(cache.getIfPresent(keyOf(request)));
    }

    public void put(CompletionRequest request, String completion) {
        if (completion != null) {
            cache.put(keyOf(request), completion);
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static String keyOf(CompletionRequest request) {
        StringBuilder raw = new StringBuilder();
        raw.append(request.getSystem()).append('\u0001')
                .append(request.getTemperature()).append('\u0001')
                .append(request.getMaxTokens()).append('\u0001');
        for (ChatMessage message : request.getMessages()) {
            raw.append(message.getRole()).append('\u0002').append(message.getContent()).append('\u0001');
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(raw.toString().getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder("llm:");
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM 不支持 SHA-256", e);
        }
    }
}
