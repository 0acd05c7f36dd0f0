package xyz.vvrf.promptchain.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import xyz.vvrf.promptchain.exception.GenerationException;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 调用 OpenAI 兼容的 {@code /chat/completions} 接口的 {@link TextGenerator}。
 * 每次调用发送一条 system 消息和一条 user 消息，返回 {@code choices[0].message.content} 去除首尾空白后的文本。
 * HTTP 错误、超时、空回复或无法解析的回复都会转换为 {@link GenerationException}。
 *
 * @author Refactored
 */
@Slf4j
public class OpenAiTextGenerator implements TextGenerator {

    private final WebClient client;
    private final ObjectMapper mapper;
    private final String model;
    private final String systemPrompt;
    private final Duration timeout;
    private final boolean apiKeyPresent;

    public OpenAiTextGenerator(String baseUrl, String apiKey, String model, String systemPrompt, Duration timeout) {
        this(WebClient.builder(), new ObjectMapper(), baseUrl, apiKey, model, systemPrompt, timeout);
    }

    public OpenAiTextGenerator(WebClient.Builder clientBuilder,
                               ObjectMapper mapper,
                               String baseUrl,
                               String apiKey,
                               String model,
                               String systemPrompt,
                               Duration timeout) {
        Objects.requireNonNull(clientBuilder, "WebClient.Builder 不能为空");
        Objects.requireNonNull(baseUrl, "baseUrl 不能为空");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper 不能为空");
        this.model = Objects.requireNonNull(model, "模型名称不能为空");
        this.systemPrompt = systemPrompt;
        this.timeout = Objects.requireNonNull(timeout, "超时不能为空");
        this.apiKeyPresent = apiKey != null && !apiKey.trim().isEmpty();

        WebClient.Builder builder = clientBuilder.clone()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (apiKeyPresent) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        this.client = builder.build();
        log.info("OpenAiTextGenerator initialized. Base URL: {}, Model: {}, Timeout: {}, API key configured: {}",
                baseUrl, model, timeout, apiKeyPresent);
    }

    @Override
    public String generate(String prompt) {
        if (!apiKeyPresent) {
            throw new GenerationException("No API key configured for the generation backend. Set OPENAI_API_KEY or prompt-chain.generation.api-key.");
        }
        log.debug("Sending prompt to model '{}' ({} characters)...", model, prompt.length());

        String json;
        try {
            json = client.post()
                    .uri("/chat/completions")
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(buildRequest(prompt))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("Chat completion request failed: status={}, model={}", e.getRawStatusCode(), model);
            throw new GenerationException(String.format("Generation backend returned HTTP %d: %s",
                    e.getRawStatusCode(), e.getResponseBodyAsString()), e);
        } catch (RuntimeException e) {
            Throwable cause = (e.getCause() instanceof TimeoutException) ? e.getCause() : e;
            if (cause instanceof TimeoutException) {
                log.warn("Chat completion request timed out after {} (model={})", timeout, model);
                throw new GenerationException("Generation call timed out after " + timeout, cause);
            }
            log.warn("Chat completion request failed: model={}, error={}", model, e.toString());
            throw new GenerationException("Generation call failed: " + e.getMessage(), e);
        }

        String content = extractContent(json);
        log.debug("...response received from model '{}' ({} characters).", model, content.length());
        return content;
    }

    Map<String, Object> buildRequest(String prompt) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        if (systemPrompt != null && !systemPrompt.isEmpty()) {
            request.put("messages", Arrays.asList(
                    message("system", systemPrompt),
                    message("user", prompt)));
        } else {
            request.put("messages", Collections.singletonList(message("user", prompt)));
        }
        return request;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }

    /**
     * 从 chat completion 回复中提取 {@code choices[0].message.content}。
     *
     * @throws GenerationException 回复为空、不是合法 JSON 或缺少内容
     */
    String extractContent(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new GenerationException("Generation backend returned an empty response.");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (Exception e) {
            throw new GenerationException("Generation backend returned malformed JSON.", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new GenerationException("Generation backend response has no choices[0].message.content.");
        }
        return content.asText().trim();
    }
}
