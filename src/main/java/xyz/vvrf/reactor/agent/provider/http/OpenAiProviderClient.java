package xyz.vvrf.reactor.agent.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;

/**
 * OpenAI Chat Completions 客户端 (备用提供方)。
 *
 * @author ruifeng.wen
 */
public class OpenAiProviderClient extends AbstractHttpProviderClient {

    static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final String STREAM_DONE = "[DONE]";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<ServerSentEvent<String>>() {
            };

    public OpenAiProviderClient(ProviderSettings settings, WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        super(settings, webClientBuilder, objectMapper);
    }

    @Override
    protected boolean requiresApiKey() {
        return true;
    }

    @Override
    protected Mono<String> doComplete(CompletionRequest request) {
        return webClient.post()
                .uri(COMPLETIONS_PATH)
                .headers(headers -> headers.setBearerAuth(settings.getApiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(buildBody(request, false))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    JsonNode choices = response.get("choices");
                    String content = (choices != null && choices.size() > 0)
                            ? textAt(choices.get(0), "message", "content") : null;
                    if (content == null) {
                        throw new PermanentProviderFailureException(getName(), "响应中没有 choices[0].message.content");
                    }
                    return content;
                });
    }

    @Override
    protected Flux<String> doStream(CompletionRequest request) {
        return webClient.post()
                .uri(COMPLETIONS_PATH)
                .headers(headers -> headers.setBearerAuth(settings.getApiKey()))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(buildBody(request, true))
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .map(sse -> sse.data() == null ? "" : sse.data().trim())
                .takeWhile(data -> !STREAM_DONE.equals(data))
                .handle((data, sink) -> {
                    if (data.isEmpty()) {
                        return;
                    }
                    JsonNode choices = readJson(data).get("choices");
                    if (choices != null && choices.size() > 0) {
                        String delta = textAt(choices.get(0), "delta", "content");
                        if (delta != null) {
                            sink.next(delta);
                        }
                    }
                });
    }

    ObjectNode buildBody(CompletionRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", settings.getModel());
        body.put("max_tokens", request.getMaxTokens());
        body.put("temperature", request.getTemperature());
        body.set("messages", messagesNode(request, true));
        if (stream) {
            body.put("stream", true);
        }
        return body;
    }
}
