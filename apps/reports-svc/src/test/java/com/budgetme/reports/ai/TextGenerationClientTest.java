package com.budgetme.reports.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.budgetme.reports.config.BudgetmeProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

/**
 * Exercises the chat-completion call against an embedded HttpServer.
 */
class TextGenerationClientTest {

    static HttpServer server;
    static int port;
    static final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    static final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        port = server.getAddress().getPort();
        server.createContext("/v1/chat/completions", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"[{\\\"type\\\":\\\"tip\\\"}]\"}}]}");
        });
        server.createContext("/v1/broken", exchange -> respond(exchange, 500, "{\"error\":\"upstream\"}"));
        server.createContext("/v1/blank", exchange -> respond(exchange, 200, "{\"choices\":[]}"));
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    @Test
    void returnsFirstChoiceContent() {
        TextGenerationClient client = newClient("/v1/chat/completions", "test-key");

        assertThat(client.generateText("Summarize my spending")).contains("[{\"type\":\"tip\"}]");
        assertThat(lastAuthorization.get()).isEqualTo("Bearer test-key");
        assertThat(lastBody.get())
                .contains("\"model\":\"test-model\"")
                .contains("\"max_tokens\":1200")
                .contains("Summarize my spending");
    }

    @Test
    void serverErrorYieldsEmpty() {
        assertThat(newClient("/v1/broken", "test-key").generateText("prompt")).isEmpty();
    }

    @Test
    void missingChoicesYieldEmpty() {
        assertThat(newClient("/v1/blank", "test-key").generateText("prompt")).isEmpty();
    }

    @Test
    void withoutApiKeyNothingIsSent() {
        TextGenerationClient client = newClient("/v1/chat/completions", " ");

        assertThat(client.hasCredentials()).isFalse();
        assertThat(client.generateText("prompt")).isEmpty();
    }

    private TextGenerationClient newClient(String path, String apiKey) {
        BudgetmeProperties props = new BudgetmeProperties(
                new BudgetmeProperties.Ai("openrouter", "test-model", "http://localhost:" + port + path, apiKey, null, null, 5_000),
                null,
                null,
                null,
                null,
                null);
        return new TextGenerationClient(props);
    }

    private static void respond(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
