package com.llmrouter.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RouterBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Breakers are created per provider on first use, so they cannot be declared in
     * resilience4j's static instance config.
     */
    @Bean
    public CircuitBreakerRegistry providerCircuitBreakerRegistry(LlmRouterProperties properties,
                                                                 MeterRegistry meterRegistry) {
        LlmRouterProperties.CircuitBreakerSettings settings = properties.getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .minimumNumberOfCalls(settings.getMinimumCalls())
                .slidingWindowSize(settings.getSlidingWindowSize())
                .waitDurationInOpenState(settings.getOpenDuration())
                .build();
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        return registry;
    }
}
