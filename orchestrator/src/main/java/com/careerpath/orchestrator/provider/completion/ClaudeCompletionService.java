package com.careerpath.orchestrator.provider.completion;

import com.careerpath.orchestrator.provider.ProviderException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link CompletionService} over the Anthropic Messages API.
 *
 * Raw HttpClient, one user turn per call. Transient failures (429, 5xx,
 * timeouts) are retried with exponential backoff by the "completion" Retry.
 */
@Component
public class ClaudeCompletionService implements CompletionService {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCompletionService.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    static final String PROVIDER = "completion";
    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Retry        retry;
    private final String       apiKey;
    private final String       baseUrl;
    private final String       model;
    private final int          maxTokens;
    private final Duration     timeout;

    public ClaudeCompletionService(@Value("${careerpath.completion.api-key:}") String apiKey,
                                   @Value("${careerpath.completion.base-url}") String baseUrl,
                                   @Value("${careerpath.completion.model}") String model,
                                   @Value("${careerpath.completion.max-tokens:4096}") int maxTokens,
                                   @Value("${careerpath.completion.timeout:30s}") Duration timeout,
                                   ObjectMapper objectMapper,
                                   RetryRegistry retryRegistry) {
        this.apiKey    = apiKey;
        this.baseUrl   = baseUrl;
        this.model     = model;
        this.maxTokens = maxTokens;
        this.timeout   = timeout;
        this.json      = objectMapper;
        this.retry     = retryRegistry.retry(PROVIDER);
        this.http      = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.retry.getEventPublisher().onRetry(e -> log.warn("Completion attempt {} failed, retrying in {}: {}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval(),
                e.getLastThrowable() == null ? "?" : e.getLastThrowable().getMessage()));
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "API key is not configured");
        }
        String body = requestBody(systemPrompt, userPrompt);
        return Retry.decorateSupplier(retry, () -> send(body)).get();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private String requestBody(String systemPrompt, String userPrompt) {
        try {
            // { model, max_tokens, system, messages: [{role, content}] }
            return json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", maxTokens,
                    "system",     systemPrompt == null ? "" : systemPrompt,
                    "messages",   List.of(new Message("user", userPrompt))
            ));
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "could not encode request", e);
        }
    }

    private String send(String body) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(timeout)
                .header("content-type",      "application/json")
                .header("x-api-key",          apiKey)
                .header("anthropic-version",  API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ProviderException(PROVIDER, response.statusCode(), response.body());
            }
            return json.readValue(response.body(), MessagesResponse.class).firstText();
        } catch (ProviderException e) {
            throw e;
        } catch (JsonProcessingException e) {
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "unreadable response", e);
        } catch (IOException e) {
            throw new ProviderException(PROVIDER, ProviderException.IO_ERROR, e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, "interrupted", e);
        } catch (IllegalStateException e) {
            throw new ProviderException(PROVIDER, ProviderException.NO_STATUS, e.getMessage(), e);
        }
    }
}
