package xyz.vvrf.reactor.agent.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.exception.TransientProviderFailureException;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;

/**
 * Anthropic Messages API 客户端 (主提供方)。
 * 流式响应为 SSE，正文增量来自 content_block_delta 事件。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class AnthropicProviderClient extends AbstractHttpProviderClient {

    static final String MESSAGES_PATH = "/v1/messages";
    static final String API_VERSION = "2023-06-01";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<ServerSentEvent<String>>() {
            };

    public AnthropicProviderClient(ProviderSettings settings, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(settings, webClientBuilder, objectMapper);
    }

    @Override
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    protected Mono<String> doComplete(CompletionRequest request) {
        return webClient.post()
                .uri(MESSAGES_PATH)
                .headers(headers -> {
                    headers.set("x-api-key", settings.getApiKey());
                    headers.set("anthropic-version", API_VERSION);
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildBody(request, false))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::extractText);
    }

    @Override
    protected Flux<String> doStream(CompletionRequest request) {
        return webClient.post()
                .uri(MESSAGES_PATH)
                .headers(headers -> {
                    headers.set("x-api-key", settings.getApiKey());
                    headers.set("anthropic-version", API_VERSION);
                })
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(buildBody(request, true))
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .takeUntil(sse -> "message_stop".equals(sse.event()))
                .handle((sse, sink) -> {
                    String data = sse.data();
                    if (data == null || data.isEmpty()) {
                        return;
                    }
                    JsonNode json = readJson(data);
                    String type = textAt(json, "type");
                    if ("content_block_delta".equals(type)) {
                        String text = textAt(json, "delta", "text");
                        if (text != null) {
                            sink.next(text);
                        }
                    } else if ("error".equals(type)) {
                        // 流中途的 error 事件通常是 overloaded_error
                        sink.error(new TransientProviderFailureException(getName(),
                                "流式响应错误: " + textAt(json, "error", "message")));
                    }
                });
    }

    ObjectNode buildBody(CompletionRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        if (request.getSystem() != null && !request.getSystem().isEmpty()) {
            body.put("system", request.getSystem());
        }
        body.set("messages", messagesNode(request, false));
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }

    private String extractText(JsonNode response) {
        JsonNode content = response.get("content");
        StringBuilder text = new StringBuilder();
        if (content != null && content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(textAt(block, "type"))) {
                    text.append(textAt(block, "text"));
                }
            }
        }
        if (text.length() == 0) {
            throw new PermanentProviderFailureException(getName(), "响应中没有文本内容");
        }
        return text.toString();
    }
}
