package com.llmrouter.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Router settings under the {@code llm} prefix. Fields marked volatile can be changed at
 * runtime through {@code /admin/settings}; readers pick the new value up on next use.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "llm")
public class LlmRouterProperties {

    /** Seed provider table, keyed by provider name. */
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();
    private RoutingSettings routing = new RoutingSettings();
    private HealthSettings health = new HealthSettings();
    private CacheSettings cache = new CacheSettings();
    private BatchSettings batch = new BatchSettings();
    private StatsSettings stats = new StatsSettings();
    private RequestLogSettings requestLog = new RequestLogSettings();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();

    @Data
    public static class ProviderSettings {
        private String apiBase;
        @ToString.Exclude
        private String apiKey;
        private String model;
        private int priority = 10;
        private boolean active = true;
        private boolean supportsText = true;
        private boolean supportsImage = false;
        private boolean supportsVideo = false;
        private boolean supportsGif = false;
    }

    @Data
    public static class RoutingSettings {
        private int maxAttempts = 4;
        private Duration requestTimeout = Duration.ofSeconds(90);
        private Duration attemptTimeout = Duration.ofSeconds(30);
        private boolean parseRetryEnabled = true;
        private boolean unavailableFallback = true;
    }

    @Data
    public static class HealthSettings {
        private volatile boolean pollingEnabled = true;
        private volatile Duration interval = Duration.ofSeconds(30);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private int probeConcurrency = 4;
        private String probePrompt = "Hello, this is a health check.";
    }

    @Data
    public static class CacheSettings {
        private volatile boolean enabled = true;
        private volatile Duration ttl = Duration.ofHours(1);
        private String backend = "memory";
        private int maxEntries = 10000;
        private String keyPrefix = "llm:cache:";
    }

    @Data
    public static class BatchSettings {
        private volatile boolean enabled = false;
        private volatile int concurrency = 4;
    }

    @Data
    public static class StatsSettings {
        private double ewmaAlpha = 0.2;
    }

    @Data
    public static class RequestLogSettings {
        private volatile boolean enabled = true;
        private Duration retention = Duration.ofHours(1);
        private int maxEntries = 5000;
    }

    @Data
    public static class CircuitBreakerSettings {
        private float failureRateThreshold = 50;
        private int minimumCalls = 10;
        private int slidingWindowSize = 20;
        private Duration openDuration = Duration.ofSeconds(60);
    }
}
