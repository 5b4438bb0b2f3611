package com.llmrouter.provider;

import com.llmrouter.exception.ErrorCategory;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.model.HealthStatus;
import com.llmrouter.registry.Provider;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static com.llmrouter.support.TestProviders.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpenAiCompatibleClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String COMPLETION = """
            {"id": "chatcmpl-1", "choices": [{"index": 0, "message": {"role": "assistant", "content": "{\\"should_push\\": true}"}}],
             "usage": {"prompt_tokens": 20, "completion_tokens": 7, "total_tokens": 27}}
            """;

    private final Provider provider = provider(3, "primary", 1, HealthStatus.AVAILABLE);
    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void postsChatCompletionAndReturnsMessageContent() {
        OpenAiCompatibleClient client = client(HttpStatus.OK, COMPLETION, CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider, "Analyze: hello", TIMEOUT))
                .expectNext(new Completion("{\"should_push\": true}", 27))
                .verifyComplete();

        assertEquals(1, requests.size());
        assertEquals("https://primary.example.com/v1/chat/completions", requests.get(0).url().toString());
        assertEquals("Bearer sk-primary", requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void errorPayloadInsideSuccessfulResponseIsClassified() {
        OpenAiCompatibleClient client = client(HttpStatus.OK,
                "{\"error\": {\"type\": \"rate_limit_exceeded\", \"message\": \"Slow down\"}}",
                CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider, "prompt", TIMEOUT))
                .expectErrorSatisfies(error -> {
                    ProviderCallException failure = assertInstanceOf(ProviderCallException.class, error);
                    assertEquals(ErrorCategory.RATE_LIMIT, failure.getCategory());
                    assertEquals("API error: Slow down", failure.getMessage());
                })
                .verify();
    }

    @Test
    void emptyChoicesIsParseFailure() {
        OpenAiCompatibleClient client = client(HttpStatus.OK, "{\"choices\": []}", CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider, "prompt", TIMEOUT))
                .expectErrorSatisfies(error -> assertEquals(ErrorCategory.PARSE,
                        assertInstanceOf(ProviderCallException.class, error).getCategory()))
                .verify();
    }

    @Test
    void httpErrorStatusSurfacesAsResponseException() {
        OpenAiCompatibleClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\": \"overloaded\"}",
                CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider, "prompt", TIMEOUT))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(WebClientResponseException.class, error);
                    assertEquals(ErrorCategory.SERVER, ErrorClassifier.categorize(error));
                })
                .verify();
    }

    @Test
    void providerWithoutKeyFailsWithoutNetworkCall() {
        OpenAiCompatibleClient client = client(HttpStatus.OK, COMPLETION, CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider.toBuilder().apiKey("").build(), "prompt", TIMEOUT))
                .expectErrorSatisfies(error -> assertEquals(ErrorCategory.AUTH,
                        assertInstanceOf(ProviderCallException.class, error).getCategory()))
                .verify();

        assertTrue(requests.isEmpty());
    }

    @Test
    void openBreakerShortCircuitsCompletionsButNotProbes() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .build());
        OpenAiCompatibleClient client = client(HttpStatus.INTERNAL_SERVER_ERROR, "{}", breakers);

        StepVerifier.create(client.complete(provider, "p", TIMEOUT)).expectError(WebClientResponseException.class).verify();
        StepVerifier.create(client.complete(provider, "p", TIMEOUT)).expectError(WebClientResponseException.class).verify();
        StepVerifier.create(client.complete(provider, "p", TIMEOUT)).expectError(CallNotPermittedException.class).verify();
        assertEquals(2, requests.size());

        StepVerifier.create(client.probe(provider, "ping")).expectError(WebClientResponseException.class).verify();
        assertEquals(3, requests.size());
    }

    @Test
    void missingUsageLeavesTokenCountEmpty() {
        OpenAiCompatibleClient client = client(HttpStatus.OK,
                "{\"choices\": [{\"message\": {\"content\": \"ok\"}}]}", CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.complete(provider, "prompt", TIMEOUT))
                .assertNext(completion -> {
                    assertEquals("ok", completion.getContent());
                    assertNull(completion.getTotalTokens());
                })
                .verifyComplete();
    }

    @Test
    void hangingBackendTimesOutAndTripsBreaker() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .build());
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.never();
        });
        OpenAiCompatibleClient client = new OpenAiCompatibleClient(builder, breakers);
        Duration shortTimeout = Duration.ofMillis(100);

        StepVerifier.create(client.complete(provider, "p", shortTimeout))
                .expectError(TimeoutException.class).verify(Duration.ofSeconds(5));
        StepVerifier.create(client.complete(provider, "p", shortTimeout))
                .expectError(TimeoutException.class).verify(Duration.ofSeconds(5));

        CircuitBreaker breaker = client.breakerFor(provider);
        assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
        StepVerifier.create(client.complete(provider, "p", shortTimeout))
                .expectError(CallNotPermittedException.class).verify();
        assertEquals(2, requests.size());
    }

    @Test
    void releaseRemovesProviderBreaker() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.ofDefaults();
        OpenAiCompatibleClient client = client(HttpStatus.OK, COMPLETION, breakers);
        StepVerifier.create(client.complete(provider, "p", TIMEOUT)).expectNextCount(1).verifyComplete();
        assertTrue(breakers.find("provider-3").isPresent());

        client.release(3);

        assertTrue(breakers.find("provider-3").isEmpty());
    }

    @Test
    void probeCompletesOnHealthyResponse() {
        OpenAiCompatibleClient client = client(HttpStatus.OK, COMPLETION, CircuitBreakerRegistry.ofDefaults());

        StepVerifier.create(client.probe(provider, "Hello")).verifyComplete();
    }

    @Test
    void buildsCompletionsUrlFromApiBase() {
        assertEquals("https://api.example.com/v1/chat/completions",
                OpenAiCompatibleClient.buildTargetUrl("https://api.example.com/v1/"));
        assertEquals("https://api.example.com/v1/chat/completions",
                OpenAiCompatibleClient.buildTargetUrl(" https://api.example.com/v1/chat/completions "));
    }

    private OpenAiCompatibleClient client(HttpStatus status, String body, CircuitBreakerRegistry breakers) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        return new OpenAiCompatibleClient(builder, breakers);
    }
}
