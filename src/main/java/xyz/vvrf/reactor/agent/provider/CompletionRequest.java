package xyz.vvrf.reactor.agent.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * 发给提供方的补全请求。与具体提供方的协议无关。
 *
 * @author ruifeng.wen
 */
@Value
@Builder(toBuilder = true)
public class CompletionRequest {

    @Singular
    List<ChatMessage> messages;

    /**
     * 系统提示词，可为 null。
     */
    String system;

    @Builder.Default
    double temperature = 0.7;

    @Builder.Default
    int maxTokens = 1024;

    /**
     * 单次调用的硬性截止时间；为 null 时使用提供方配置的超时。
     */
    Duration timeout;

    /**
     * 是否允许使用补全缓存。
     */
    boolean cacheable;

    /**
     * 优先尝试的提供方名称，可为 null。
     */
    String preferredProvider;
}
