package com.llmrouter.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.llmrouter.exception.ErrorCategory;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.registry.Provider;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever a provider call threw onto the routing error taxonomy.
 */
public final class ErrorClassifier {

    private static final int MAX_BODY_CHARS = 200;

    private ErrorClassifier() {
    }

    public static ProviderCallException classify(Provider provider, Throwable error) {
        if (error instanceof ProviderCallException) {
            return (ProviderCallException) error;
        }
        return new ProviderCallException(categorize(error), provider.getId(), provider.getName(),
                describe(error), error);
    }

    public static ErrorCategory categorize(Throwable error) {
        if (error instanceof TimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        if (error instanceof WebClientResponseException) {
            return fromStatus(((WebClientResponseException) error).getStatusCode().value());
        }
        if (error instanceof WebClientRequestException) {
            return causedByTimeout(error) ? ErrorCategory.TIMEOUT : ErrorCategory.NETWORK;
        }
        if (error instanceof CallNotPermittedException) {
            return ErrorCategory.SERVER;
        }
        if (error instanceof DecodingException || hasCause(error, JsonProcessingException.class)) {
            return ErrorCategory.PARSE;
        }
        if (causedByTimeout(error)) {
            return ErrorCategory.TIMEOUT;
        }
        if (hasCause(error, IOException.class)) {
            return ErrorCategory.NETWORK;
        }
        return ErrorCategory.SERVER;
    }

    public static ErrorCategory fromStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorCategory.AUTH;
        }
        if (status == 429) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (status == 504) {
            return ErrorCategory.TIMEOUT;
        }
        if (status >= 500) {
            return ErrorCategory.SERVER;
        }
        return ErrorCategory.CLIENT;
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "Request timed out";
        }
        if (error instanceof WebClientResponseException) {
            WebClientResponseException e = (WebClientResponseException) error;
            String body = e.getResponseBodyAsString();
            if (body.length() > MAX_BODY_CHARS) {
                body = body.substring(0, MAX_BODY_CHARS);
            }
            return "HTTP " + e.getStatusCode().value() + (body.isEmpty() ? "" : " - " + body);
        }
        if (error instanceof CallNotPermittedException) {
            return "Circuit breaker open: " + error.getMessage();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static boolean causedByTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }
}
