package xyz.vvrf.reactor.agent.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;

/**
 * 本地 Ollama 客户端 (最后的兜底)。不需要凭证，流式响应为 NDJSON。
 *
 * @author ruifeng.wen
 */
public class OllamaProviderClient extends AbstractHttpProviderClient {

    static final String CHAT_PATH = "/api/chat";

    public OllamaProviderClient(ProviderSettings settings, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(settings, webClientBuilder, objectMapper);
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }

    @Override
    protected Mono<String> doComplete(CompletionRequest request) {
        return webClient.post()
                .uri(CHAT_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildBody(request, false))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    String content = textAt(response, "message", "content");
                    if (content == null) {
                        throw new PermanentProviderFailureException(getName(), "响应中没有 message.content");
                    }
                    return content;
                });
    }

    @Override
    protected Flux<String> doStream(CompletionRequest request) {
        return webClient.post()
                .uri(CHAT_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_NDJSON)
                .bodyValue(buildBody(request, true))
                .retrieve()
                .bodyToFlux(JsonNode.class)
                .takeUntil(line -> line.path("done").asBoolean(false))
                .handle((line, sink) -> {
                    String content = textAt(line, "message", "content");
                    if (content != null) {
                        sink.next(content);
                    }
                });
    }

    ObjectNode buildBody(CompletionRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.set("messages", messagesNode(request, true));
        body.put("stream", stream);
        ObjectNode options = body.putObject("options");
        options.put("temperature", request.getTemperature());
        options.put("num_predict", request.getMaxTokens());
        return body;
    }
}
