package xyz.vvrf.promptchain.generation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import xyz.vvrf.promptchain.exception.GenerationException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiTextGeneratorTest {

    private static final String OK_BODY =
            "{\"id\":\"c1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"  Hello there.\\n\"}}]}";

    private static OpenAiTextGenerator generator(ExchangeFunction exchange, String apiKey, Duration timeout) {
        return new OpenAiTextGenerator(WebClient.builder().exchangeFunction(exchange), new ObjectMapper(),
                "http://llm.test/v1", apiKey, "test-model", "Follow the instructions.", timeout);
    }

    private static ExchangeFunction respond(HttpStatus status, String body, AtomicReference<ClientRequest> captured) {
        return request -> {
            if (captured != null) {
                captured.set(request);
            }
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
        };
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, String>> messagesOf(Map<String, Object> request) {
        return (List<Map<String, String>>) request.get("messages");
    }

    @Test
    void returnsTrimmedMessageContent() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        OpenAiTextGenerator generator = generator(respond(HttpStatus.OK, OK_BODY, captured), "sk-test", Duration.ofSeconds(5));

        assertThat(generator.generate("Say hello")).isEqualTo("Hello there.");
        ClientRequest request = captured.get();
        assertThat(request.url().toString()).isEqualTo("http://llm.test/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    }

    @Test
    void httpErrorsBecomeGenerationExceptions() {
        OpenAiTextGenerator generator = generator(
                respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"down\"}", null), "sk-test", Duration.ofSeconds(5));

        assertThatThrownBy(() -> generator.generate("Say hello"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void slowBackendTimesOut() {
        ExchangeFunction never = request -> Mono.never();
        OpenAiTextGenerator generator = generator(never, "sk-test", Duration.ofMillis(100));

        assertThatThrownBy(() -> generator.generate("Say hello"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    void missingApiKeyFailsWithoutCallingBackend() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        OpenAiTextGenerator generator = generator(respond(HttpStatus.OK, OK_BODY, captured), "  ", Duration.ofSeconds(5));

        assertThatThrownBy(() -> generator.generate("Say hello"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("API key");
        assertThat(captured.get()).isNull();
    }

    @Test
    void requestContainsSystemAndUserMessages() {
        OpenAiTextGenerator generator = generator(respond(HttpStatus.OK, OK_BODY, null), "sk-test", Duration.ofSeconds(5));

        Map<String, Object> request = generator.buildRequest("Summarize this");

        assertThat(request).containsEntry("model", "test-model");
        List<Map<String, String>> messages = messagesOf(request);
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).containsEntry("role", "system").containsEntry("content", "Follow the instructions.");
        assertThat(messages.get(1)).containsEntry("role", "user").containsEntry("content", "Summarize this");
    }

    @Test
    void requestWithoutSystemPromptHasOnlyUserMessage() {
        OpenAiTextGenerator generator = new OpenAiTextGenerator(WebClient.builder(), new ObjectMapper(),
                "http://llm.test/v1", "sk-test", "test-model", null, Duration.ofSeconds(5));

        assertThat(messagesOf(generator.buildRequest("hi"))).hasSize(1);
    }

    @Test
    void malformedResponsesAreRejected() {
        OpenAiTextGenerator generator = generator(respond(HttpStatus.OK, OK_BODY, null), "sk-test", Duration.ofSeconds(5));

        assertThatThrownBy(() -> generator.extractContent("")).isInstanceOf(GenerationException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> generator.extractContent("not json")).isInstanceOf(GenerationException.class)
                .hasMessageContaining("malformed");
        assertThatThrownBy(() -> generator.extractContent("{\"choices\":[]}")).isInstanceOf(GenerationException.class)
                .hasMessageContaining("choices[0].message.content");
    }
}
