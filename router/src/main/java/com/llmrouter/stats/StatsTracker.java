package com.llmrouter.stats;

import com.llmrouter.exception.LlmRoutingException;
import com.llmrouter.registry.Provider;
import com.llmrouter.registry.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Records per-provider call outcomes in the registry and mirrors them to Micrometer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatsTracker {

    private final ProviderRegistry registry;
    private final MeterRegistry meterRegistry;

    public void recordSuccess(Provider provider, long elapsedMs) {
        registry.recordUsage(provider.getId(), true, Duration.ofMillis(elapsedMs), null);
        meterRegistry.counter("llm.provider.requests",
                "provider", provider.getName(), "status", "success", "category", "none").increment();
        meterRegistry.timer("llm.provider.latency", "provider", provider.getName())
                .record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void recordError(Provider provider, LlmRoutingException error) {
        registry.recordUsage(provider.getId(), false, Duration.ZERO,
                "[" + error.getCategory().getCode() + "] " + error.getMessage());
        meterRegistry.counter("llm.provider.requests",
                "provider", provider.getName(), "status", "error",
                "category", error.getCategory().getCode()).increment();
    }
}
