package com.llmrouter.provider;

import com.llmrouter.registry.Provider;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Outbound call to one provider's completion API. Failures surface as raw client errors or
 * {@link com.llmrouter.exception.ProviderCallException} and are classified by {@link ErrorClassifier}.
 */
public interface LlmClient {

    /**
     * Runs one completion. A call still pending after {@code timeout} fails with a
     * {@link java.util.concurrent.TimeoutException} that counts against the provider's breaker.
     */
    Mono<Completion> complete(Provider provider, String prompt, Duration timeout);

    /**
     * Minimal request proving the provider answers; completes empty on success.
     */
    Mono<Void> probe(Provider provider, String prompt);

    /**
     * Drops per-provider client state once the provider has been deleted.
     */
    void release(long providerId);
}
