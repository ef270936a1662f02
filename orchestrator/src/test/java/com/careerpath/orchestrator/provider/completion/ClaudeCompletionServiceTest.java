package com.careerpath.orchestrator.provider.completion;

import com.careerpath.orchestrator.config.ResilienceConfig;
import com.careerpath.orchestrator.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the adapter against a local JDK HttpServer that scripts the
 * provider's status codes.
 */
class ClaudeCompletionServiceTest {

    private static final String OK_BODY = """
            {"id":"msg_1","type":"message","role":"assistant",
             "content":[{"type":"text","text":"[{\\"skillName\\":\\"SQL\\"}]"}]}
            """;

    private final ObjectMapper json = new ObjectMapper();
    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();
    private final List<String> apiKeys = new CopyOnWriteArrayList<>();

    private HttpServer server;
    private List<Integer> script;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/messages", exchange -> {
            int n = calls.getAndIncrement();
            requestBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            apiKeys.add(exchange.getRequestHeaders().getFirst("x-api-key"));
            int status = n < script.size() ? script.get(n) : 200;
            byte[] out = (status == 200 ? OK_BODY : "{\"error\":\"busy\"}").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private ClaudeCompletionService service(String apiKey) {
        RetryRegistry retries = RetryRegistry.of(ResilienceConfig.retryConfig(3, Duration.ofMillis(1), 2.0));
        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        return new ClaudeCompletionService(apiKey, baseUrl, "claude-test", 1024, Duration.ofSeconds(5), json, retries);
    }

    @Test
    void complete_returnsFirstTextBlock_andSendsSystemPrompt() throws Exception {
        script = List.of();

        String text = service("key-1").complete("You are a career analyst.", "Analyze this");

        assertThat(text).isEqualTo("[{\"skillName\":\"SQL\"}]");
        assertThat(apiKeys).containsExactly("key-1");
        JsonNode sent = json.readTree(requestBodies.get(0));
        assertThat(sent.get("model").asText()).isEqualTo("claude-test");
        assertThat(sent.get("max_tokens").asInt()).isEqualTo(1024);
        assertThat(sent.get("system").asText()).isEqualTo("You are a career analyst.");
        assertThat(sent.get("messages").get(0).get("content").asText()).isEqualTo("Analyze this");
    }

    @Test
    void complete_retriesRateLimitAndServerErrors() {
        script = List.of(429, 503);

        String text = service("key-1").complete("system", "user");

        assertThat(text).contains("SQL");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void complete_givesUpAfterMaxRetries() {
        script = List.of(500, 500, 500, 500, 500);

        assertThatThrownBy(() -> service("key-1").complete("system", "user"))
                .isInstanceOfSatisfying(ProviderException.class, e -> assertThat(e.statusCode()).isEqualTo(500));
        assertThat(calls.get()).isEqualTo(4);   // first attempt + 3 retries
    }

    @Test
    void complete_clientErrorIsNotRetried() {
        script = List.of(400);

        assertThatThrownBy(() -> service("key-1").complete("system", "user"))
                .isInstanceOf(ProviderException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void complete_withoutApiKey_failsWithoutCallingProvider() {
        script = List.of();

        assertThatThrownBy(() -> service("").complete("system", "user"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("API key");
        assertThat(calls.get()).isZero();
    }
}
