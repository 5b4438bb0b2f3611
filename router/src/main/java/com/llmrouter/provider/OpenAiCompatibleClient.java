package com.llmrouter.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmrouter.exception.ErrorCategory;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.registry.Provider;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Talks the OpenAI chat-completions dialect, which most hosted and self-hosted backends accept.
 * Each provider gets its own circuit breaker so a dead backend is skipped quickly.
 */
@Slf4j
@Component
public class OpenAiCompatibleClient implements LlmClient {

    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final WebClient webClient;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public OpenAiCompatibleClient(WebClient.Builder webClientBuilder,
                                  CircuitBreakerRegistry circuitBreakerRegistry) {
        this.webClient = webClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @Override
    public Mono<Completion> complete(Provider provider, String prompt, Duration timeout) {
        if (!hasCredentials(provider)) {
            return Mono.error(missingCredentials(provider));
        }

        log.debug("Completion request: provider={}, model={}", provider.getName(), provider.getModel());

        Map<String, Object> body = new HashMap<>();
        body.put("model", provider.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));

        // the timeout sits inside the breaker so a hanging backend counts as a failed call
        return post(provider, body)
                .map(response -> new Completion(extractContent(provider, response), totalTokens(response)))
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(breakerFor(provider)));
    }

    @Override
    public Mono<Void> probe(Provider provider, String prompt) {
        if (!hasCredentials(provider)) {
            return Mono.error(missingCredentials(provider));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", provider.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", 10);

        // probes bypass the breaker so an open breaker cannot hide a recovered backend
        return post(provider, body)
                .doOnNext(response -> rejectErrorPayload(provider, response))
                .then();
    }

    @Override
    public void release(long providerId) {
        circuitBreakerRegistry.remove(breakerName(providerId))
                .ifPresent(breaker -> log.debug("Removed circuit breaker {}", breaker.getName()));
    }

    CircuitBreaker breakerFor(Provider provider) {
        return circuitBreakerRegistry.circuitBreaker(breakerName(provider.getId()));
    }

    private static String breakerName(long providerId) {
        return "provider-" + providerId;
    }

    static String buildTargetUrl(String apiBase) {
        String base = apiBase.trim();
        if (base.endsWith(COMPLETIONS_PATH)) {
            return base;
        }
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + COMPLETIONS_PATH;
    }

    private Mono<CompletionResponse> post(Provider provider, Map<String, Object> body) {
        return webClient.post()
                .uri(buildTargetUrl(provider.getApiBase()))
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(CompletionResponse.class);
    }

    private String extractContent(Provider provider, CompletionResponse response) {
        rejectErrorPayload(provider, response);
        if (response.getChoices() == null || response.getChoices().isEmpty()
                || response.getChoices().get(0).getMessage() == null) {
            throw new ProviderCallException(ErrorCategory.PARSE, provider.getId(), provider.getName(),
                    "Response contained no choices");
        }
        String content = response.getChoices().get(0).getMessage().getContent();
        if (content == null || content.isBlank()) {
            throw new ProviderCallException(ErrorCategory.PARSE, provider.getId(), provider.getName(),
                    "Response message was empty");
        }
        return content;
    }

    private static Integer totalTokens(CompletionResponse response) {
        return response.getUsage() != null ? response.getUsage().getTotalTokens() : null;
    }

    /**
     * Some gateways answer 200 with an {@code error} object instead of an HTTP error status.
     */
    private void rejectErrorPayload(Provider provider, CompletionResponse response) {
        ApiError error = response.getError();
        if (error == null) {
            return;
        }
        String type = error.getType() != null ? error.getType().toLowerCase(Locale.ROOT) : "";
        String message = error.getMessage() != null ? error.getMessage() : "Unknown error";
        String lowerMessage = message.toLowerCase(Locale.ROOT);

        ErrorCategory category;
        if (type.contains("rate_limit") || lowerMessage.contains("rate limit")) {
            category = ErrorCategory.RATE_LIMIT;
        } else if (type.contains("authentication") || type.contains("invalid_api_key")) {
            category = ErrorCategory.AUTH;
        } else if (type.contains("server_error")) {
            category = ErrorCategory.SERVER;
        } else {
            category = ErrorCategory.CLIENT;
        }
        throw new ProviderCallException(category, provider.getId(), provider.getName(), "API error: " + message);
    }

    private static boolean hasCredentials(Provider provider) {
        return provider.getApiBase() != null && !provider.getApiBase().isBlank()
                && provider.getApiKey() != null && !provider.getApiKey().isBlank();
    }

    private static ProviderCallException missingCredentials(Provider provider) {
        return new ProviderCallException(ErrorCategory.AUTH, provider.getId(), provider.getName(),
                "Provider has no API base or API key configured");
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CompletionResponse {
        private List<Choice> choices;
        private Usage usage;
        private ApiError error;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Usage {
        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Choice {
        private Message message;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Message {
        private String role;
        private String content;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ApiError {
        private String message;
        private String type;
    }
}
