package com.llmrouter.provider;

import com.fasterxml.jackson.core.JsonParseException;
import com.llmrouter.exception.ErrorCategory;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.model.HealthStatus;
import com.llmrouter.registry.Provider;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static com.llmrouter.support.TestProviders.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    private final Provider provider = provider(7, "primary", 1, HealthStatus.AVAILABLE);

    @Test
    void mapsHttpStatusCodes() {
        assertEquals(ErrorCategory.AUTH, ErrorClassifier.fromStatus(401));
        assertEquals(ErrorCategory.AUTH, ErrorClassifier.fromStatus(403));
        assertEquals(ErrorCategory.RATE_LIMIT, ErrorClassifier.fromStatus(429));
        assertEquals(ErrorCategory.TIMEOUT, ErrorClassifier.fromStatus(504));
        assertEquals(ErrorCategory.SERVER, ErrorClassifier.fromStatus(502));
        assertEquals(ErrorCategory.CLIENT, ErrorClassifier.fromStatus(400));
    }

    @Test
    void classifiesTransportFailures() {
        WebClientRequestException refused = new WebClientRequestException(new ConnectException("Connection refused"),
                HttpMethod.POST, URI.create("https://api.example.com"), HttpHeaders.EMPTY);

        assertEquals(ErrorCategory.NETWORK, ErrorClassifier.categorize(refused));
        assertEquals(ErrorCategory.TIMEOUT, ErrorClassifier.categorize(new TimeoutException("slow")));
        assertEquals(ErrorCategory.PARSE, ErrorClassifier.categorize(
                new DecodingException("bad body", new JsonParseException(null, "unexpected token"))));
        assertEquals(ErrorCategory.SERVER, ErrorClassifier.categorize(
                CallNotPermittedException.createCallNotPermittedException(CircuitBreaker.ofDefaults("provider-7"))));
        assertEquals(ErrorCategory.SERVER, ErrorClassifier.categorize(new IllegalStateException("unexpected")));
    }

    @Test
    void describesHttpErrorWithTruncatedBody() {
        String body = "x".repeat(500);
        WebClientResponseException error = WebClientResponseException.create(503, "Service Unavailable",
                HttpHeaders.EMPTY, body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        ProviderCallException classified = ErrorClassifier.classify(provider, error);

        assertEquals(ErrorCategory.SERVER, classified.getCategory());
        assertEquals(7L, classified.getProviderId());
        assertEquals("primary", classified.getProviderName());
        assertTrue(classified.getMessage().startsWith("HTTP 503 - "));
        assertEquals("HTTP 503 - ".length() + 200, classified.getMessage().length());
    }

    @Test
    void onlyTransientCategoriesAreRetryable() {
        assertTrue(ErrorCategory.TIMEOUT.isRetryable());
        assertTrue(ErrorCategory.RATE_LIMIT.isRetryable());
        assertFalse(ErrorCategory.AUTH.isRetryable());
        assertFalse(ErrorCategory.PARSE.isRetryable());
    }

    @Test
    void passesThroughAlreadyClassifiedErrors() {
        ProviderCallException original = new ProviderCallException(ErrorCategory.PARSE, 7L, "primary", "empty");

        assertSame(original, ErrorClassifier.classify(provider, original));
    }
}
