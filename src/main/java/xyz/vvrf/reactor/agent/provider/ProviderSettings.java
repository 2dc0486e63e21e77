package xyz.vvrf.reactor.agent.provider;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 单个提供方的连接配置。
 *
 * @author ruifeng.wen
 */
@Value
@Builder
public class ProviderSettings {

    String name;
    ProviderVariant variant;
    boolean enabled;
    String baseUrl;
    String apiKey;
    String model;
    @Builder.Default
    Duration timeout = Duration.ofSeconds(60);

    /**
     * 需要凭证的提供方在没有 apiKey 时视为不可用。
     */
    public boolean isUsable(boolean requiresApiKey) {
        if (!enabled || baseUrl == null || baseUrl.trim().isEmpty()) {
            return false;
        }
        return !requiresApiKey || (apiKey != null && !apiKey.trim().isEmpty());
    }
}
