package xyz.vvrf.reactor.agent.provider.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.reactor.agent.core.CancellationToken;
import xyz.vvrf.reactor.agent.exception.PermanentProviderFailureException;
import xyz.vvrf.reactor.agent.exception.TransientProviderFailureException;
import xyz.vvrf.reactor.agent.provider.ChatMessage;
import xyz.vvrf.reactor.agent.provider.CompletionRequest;
import xyz.vvrf.reactor.agent.provider.ProviderSettings;
import xyz.vvrf.reactor.agent.provider.ProviderVariant;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpProviderClientsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> sent = new CopyOnWriteArrayList<>();

    @Test
    void anthropic_completeJoinsTextBlocksAndSendsHeaders() {
        AnthropicProviderClient client = new AnthropicProviderClient(settings("anthropic", ProviderVariant.PRIMARY, "sk-test"),
                respondWith(HttpStatus.OK, MediaType.APPLICATION_JSON,
                        "{\"content\":[{\"type\":\"text\",\"text\":\"Hello\"},{\"type\":\"text\",\"text\":\" there\"}]}"),
                objectMapper);

        StepVerifier.create(client.complete(request(), new CancellationToken()))
                .expectNext("Hello there")
                .verifyComplete();

        ClientRequest request = sent.get(0);
        assertEquals("http://provider.test/v1/messages", request.url().toString());
        assertEquals("sk-test", request.headers().getFirst("x-api-key"));
        assertEquals(AnthropicProviderClient.API_VERSION, request.headers().getFirst("anthropic-version"));
    }

    @Test
    void anthropic_streamEmitsTextDeltasUntilMessageStop() {
        String sse = event("message_start", "{\"type\":\"message_start\"}")
                + event("content_block_delta", "{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":\"Hel\"}}")
                + event("ping", "{\"type\":\"ping\"}")
                + event("content_block_delta", "{\"type\":\"content_block_delta\",\"delta\":{\"type\":\"text_delta\",\"text\":\"lo\"}}")
                + event("message_stop", "{\"type\":\"message_stop\"}");
        AnthropicProviderClient client = new AnthropicProviderClient(settings("anthropic", ProviderVariant.PRIMARY, "sk"),
                respondWith(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM, sse), objectMapper);

        StepVerifier.create(client.stream(request(), new CancellationToken()))
                .expectNext("Hel", "lo")
                .verifyComplete();
    }

    @Test
    void anthropic_streamErrorEventIsTransient() {
        String sse = event("content_block_delta", "{\"type\":\"content_block_delta\",\"delta\":{\"text\":\"A\"}}")
                + event("error", "{\"type\":\"error\",\"error\":{\"type\":\"overloaded_error\",\"message\":\"Overloaded\"}}");
        AnthropicProviderClient client = new AnthropicProviderClient(settings("anthropic", ProviderVariant.PRIMARY, "sk"),
                respondWith(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM, sse), objectMapper);

        StepVerifier.create(client.stream(request(), new CancellationToken()))
                .expectNext("A")
                .expectError(TransientProviderFailureException.class)
                .verify();
    }

    @Test
    void anthropic_buildBodyKeepsSystemOutsideMessages() {
        AnthropicProviderClient client = new AnthropicProviderClient(settings("anthropic", ProviderVariant.PRIMARY, "sk"),
                WebClient.builder(), objectMapper);

        ObjectNode body = client.buildBody(request(), true);

        assertEquals("test-model", body.get("model").asText());
        assertEquals("Be brief.", body.get("system").asText());
        assertEquals(1, body.get("messages").size());
        assertEquals(256, body.get("max_tokens").asInt());
        assertTrue(body.get("stream").asBoolean());
    }

    @Test
    void anthropic_disabledWithoutApiKey() {
        AnthropicProviderClient client = new AnthropicProviderClient(settings("anthropic", ProviderVariant.PRIMARY, ""),
                WebClient.builder(), objectMapper);

        assertFalse(client.isEnabled());
    }

    @Test
    void serverErrorIsTransientAndClientErrorIsPermanent() {
        OpenAiProviderClient overloaded = new OpenAiProviderClient(settings("openai", ProviderVariant.FALLBACK, "sk"),
                respondWith(HttpStatus.SERVICE_UNAVAILABLE, MediaType.APPLICATION_JSON, "{}"), objectMapper);
        OpenAiProviderClient rejected = new OpenAiProviderClient(settings("openai", ProviderVariant.FALLBACK, "sk"),
                respondWith(HttpStatus.UNAUTHORIZED, MediaType.APPLICATION_JSON, "{}"), objectMapper);

        StepVerifier.create(overloaded.complete(request(), new CancellationToken()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof TransientProviderFailureException);
                    assertEquals(503, ((TransientProviderFailureException) error).getStatusCode());
                })
                .verify();
        StepVerifier.create(rejected.complete(request(), new CancellationToken()))
                .expectError(PermanentProviderFailureException.class)
                .verify();
    }

    @Test
    void openAi_completeReadsFirstChoiceAndUsesBearerAuth() {
        OpenAiProviderClient client = new OpenAiProviderClient(settings("openai", ProviderVariant.FALLBACK, "sk-openai"),
                respondWith(HttpStatus.OK, MediaType.APPLICATION_JSON,
                        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"42\"}}]}"),
                objectMapper);

        StepVerifier.create(client.complete(request(), new CancellationToken()))
                .expectNext("42")
                .verifyComplete();

        assertEquals("Bearer sk-openai", sent.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertTrue(sent.get(0).url().getPath().endsWith(OpenAiProviderClient.COMPLETIONS_PATH));
    }

    @Test
    void openAi_streamStopsAtDoneMarker() {
        String sse = "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"Hi\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"!\"}}]}\n\n"
                + "data: [DONE]\n\n";
        OpenAiProviderClient client = new OpenAiProviderClient(settings("openai", ProviderVariant.FALLBACK, "sk"),
                respondWith(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM, sse), objectMapper);

        StepVerifier.create(client.stream(request(), new CancellationToken()))
                .expectNext("Hi", "!")
                .verifyComplete();
    }

    @Test
    void openAi_buildBodyPutsSystemFirst() {
        OpenAiProviderClient client = new OpenAiProviderClient(settings("openai", ProviderVariant.FALLBACK, "sk"),
                WebClient.builder(), objectMapper);

        JsonNode messages = client.buildBody(request(), false).get("messages");

        assertEquals(2, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("user", messages.get(1).get("role").asText());
    }

    @Test
    void ollama_streamReadsNdjsonUntilDone() {
        String ndjson = "{\"message\":{\"role\":\"assistant\",\"content\":\"lo\"},\"done\":false}\n"
                + "{\"message\":{\"role\":\"assistant\",\"content\":\"cal\"},\"done\":false}\n"
                + "{\"message\":{\"role\":\"assistant\",\"content\":\"\"},\"done\":true}\n";
        OllamaProviderClient client = new OllamaProviderClient(settings("ollama", ProviderVariant.LOCAL, null),
                respondWith(HttpStatus.OK, MediaType.APPLICATION_NDJSON, ndjson), objectMapper);

        assertTrue(client.isEnabled());
        StepVerifier.create(client.stream(request(), new CancellationToken()))
                .expectNext("lo", "cal")
                .verifyComplete();
    }

    @Test
    void ollama_buildBodyUsesOptions() {
        OllamaProviderClient client = new OllamaProviderClient(settings("ollama", ProviderVariant.LOCAL, null),
                WebClient.builder(), objectMapper);

        ObjectNode body = client.buildBody(request(), false);

        assertFalse(body.get("stream").asBoolean());
        assertEquals(256, body.get("options").get("num_predict").asInt());
    }

    @Test
    void complete_requestTimeoutBecomesTransientFailure() {
        OllamaProviderClient client = new OllamaProviderClient(settings("ollama", ProviderVariant.LOCAL, null),
                WebClient.builder().exchangeFunction(request -> Mono.never()), objectMapper);
        CompletionRequest request = request().toBuilder().timeout(Duration.ofMillis(50)).build();

        StepVerifier.create(client.complete(request, new CancellationToken()))
                .expectError(TransientProviderFailureException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void stream_deadlineBoundsWholeStreamEvenWhenChunksKeepArriving() {
        DrippingProviderClient client = new DrippingProviderClient(Duration.ofMillis(50), 10);
        CompletionRequest request = request().toBuilder().timeout(Duration.ofMillis(200)).build();
        List<String> chunks = new CopyOnWriteArrayList<>();
        long start = System.nanoTime();

        StepVerifier.create(client.stream(request, new CancellationToken()).doOnNext(chunks::add))
                .thenConsumeWhile(chunk -> true)
                .expectError(TransientProviderFailureException.class)
                .verify(Duration.ofSeconds(5));

        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();
        assertTrue(chunks.size() < 10, "截止时间之后不应再收到片段: " + chunks);
        assertTrue(elapsedMillis < 600, "流应在截止时间附近被切断，实际耗时 " + elapsedMillis + "ms");
    }

    @Test
    void complete_cancelledTokenStopsCall() {
        OllamaProviderClient client = new OllamaProviderClient(settings("ollama", ProviderVariant.LOCAL, null),
                WebClient.builder().exchangeFunction(request -> Mono.never()), objectMapper);
        CancellationToken token = new CancellationToken();

        StepVerifier.create(client.complete(request(), token))
                .then(token::cancel)
                .verifyComplete();
    }

    /**
     * 按固定间隔持续输出片段的提供方。
     */
    private final class DrippingProviderClient extends AbstractHttpProviderClient {

        private final Duration interval;
        private final int count;

        private DrippingProviderClient(Duration interval, int count) {
            super(settings("drip", ProviderVariant.LOCAL, null), WebClient.builder(), HttpProviderClientsTest.this.objectMapper);
            this.interval = interval;
            this.count = count;
        }

        @Override
        protected boolean requiresApiKey() {
            return false;
        }

        @Override
        protected Mono<String> doComplete(CompletionRequest request) {
            return Mono.just("done");
        }

        @Override
        protected Flux<String> doStream(CompletionRequest request) {
            return Flux.interval(interval).take(count).map(i -> "c" + i);
        }
    }

    private WebClient.Builder respondWith(HttpStatus status, MediaType contentType, String body) {
        return WebClient.builder().exchangeFunction(request -> {
            sent.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, contentType.toString())
                    .body(body)
                    .build());
        });
    }

    private static String event(String name, String data) {
        return "event: " + name + "\ndata: " + data + "\n\n";
    }

    private static ProviderSettings settings(String name, ProviderVariant variant, String apiKey) {
        return ProviderSettings.builder()
                .name(name)
                .variant(variant)
                .enabled(true)
                .baseUrl("http://provider.test")
                .apiKey(apiKey)
                .model("test-model")
                .build();
    }

    private static CompletionRequest request() {
        return CompletionRequest.builder()
                .system("Be brief.")
                .message(ChatMessage.user("Say hi"))
                .maxTokens(256)
                .build();
    }
}
