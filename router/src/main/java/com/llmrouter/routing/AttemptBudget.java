package com.llmrouter.routing;

import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.exception.ProvidersExhaustedException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-request attempt counter and last failure. Attempts run one at a time, but a deadline
 * cancellation can arrive from a timer thread, hence the atomics.
 */
class AttemptBudget {

    private final int maxAttempts;
    private final long startNanos = System.nanoTime();
    private final AtomicInteger used = new AtomicInteger();
    private final AtomicReference<ProviderCallException> lastError = new AtomicReference<>();

    AttemptBudget(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    boolean hasRemaining() {
        return used.get() < maxAttempts;
    }

    int consume() {
        return used.incrementAndGet();
    }

    /**
     * Returns an attempt that never reached the provider.
     */
    void refund() {
        used.decrementAndGet();
    }

    int used() {
        return used.get();
    }

    void recordFailure(ProviderCallException error) {
        lastError.set(error);
    }

    long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    ProvidersExhaustedException exhausted(String reason) {
        return new ProvidersExhaustedException(reason, used.get(), lastError.get());
    }
}
