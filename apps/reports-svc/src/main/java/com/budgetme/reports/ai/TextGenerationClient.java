package com.budgetme.reports.ai;

import com.budgetme.reports.config.BudgetmeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Chat-completion client for an OpenAI-compatible text-generation endpoint (OpenRouter by default).
 */
@Component
public class TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(TextGenerationClient.class);

    private final BudgetmeProperties.Ai settings;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record ChatCompletionRequest(String model, List<Message> messages, Double temperature, Integer max_tokens) {}

    @Autowired
    public TextGenerationClient(BudgetmeProperties properties) {
        this(properties, RestClient.builder().requestFactory(requestFactory(properties.ai())));
        log.info("Text generation client configured: provider={} model={} readTimeoutMs={}",
                settings.provider(), settings.model(), settings.timeoutMs());
    }

    private TextGenerationClient(BudgetmeProperties properties, RestClient.Builder builder) {
        this.settings = properties.ai();
        this.restClient = builder.build();
    }

    public boolean hasCredentials() {
        return settings.hasApiKey();
    }

    public String model() {
        return settings.model();
    }

    public Optional<String> generateText(String prompt) {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        ChatCompletionRequest request = new ChatCompletionRequest(
                settings.model(),
                List.of(new Message("user", prompt)),
                settings.temperature(),
                settings.maxTokens());
        try {
            JsonNode response = restClient.post()
                    .uri(settings.endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> {
                        headers.setBearerAuth(settings.apiKey());
                        headers.set("X-Title", "BudgetMe - Financial Insights");
                    })
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                log.warn("Text generation: empty response body from {}", settings.provider());
                return Optional.empty();
            }
            String content = response.path("choices").path(0).path("message").path("content").asText(null);
            return Optional.ofNullable(content).filter(text -> !text.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("Text generation: {} returned status {}: {}",
                    settings.provider(), ex.getStatusCode().value(), ex.getResponseBodyAsString());
            return Optional.empty();
        } catch (RestClientException ex) {
            log.warn("Text generation: request to {} failed: {}", settings.provider(), ex.getMessage());
            return Optional.empty();
        }
    }

    private static SimpleClientHttpRequestFactory requestFactory(BudgetmeProperties.Ai ai) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(12));
        requestFactory.setReadTimeout(Duration.ofMillis(ai.timeoutMs()));
        return requestFactory;
    }
}
