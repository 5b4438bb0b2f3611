package com.llmrouter.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmrouter.config.LlmRouterProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Runtime-adjustable settings. Changes are written straight into {@link LlmRouterProperties},
 * whose readers re-read them on every use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final LlmRouterProperties properties;

    public RuntimeSettings current() {
        return RuntimeSettings.builder()
                .healthCheckIntervalSeconds(properties.getHealth().getInterval().toSeconds())
                .pollingEnabled(properties.getHealth().isPollingEnabled())
                .cacheEnabled(properties.getCache().isEnabled())
                .cacheTtlSeconds(properties.getCache().getTtl().toSeconds())
                .batchEnabled(properties.getBatch().isEnabled())
                .batchConcurrency((long) properties.getBatch().getConcurrency())
                .build();
    }

    /**
     * Applies the non-null fields of the update.
     *
     * @throws IllegalArgumentException if a numeric value is not positive
     */
    public RuntimeSettings update(RuntimeSettings update) {
        if (update.getHealthCheckIntervalSeconds() != null) {
            properties.getHealth().setInterval(
                    Duration.ofSeconds(positive("health_check_interval_seconds", update.getHealthCheckIntervalSeconds())));
        }
        if (update.getPollingEnabled() != null) {
            properties.getHealth().setPollingEnabled(update.getPollingEnabled());
        }
        if (update.getCacheEnabled() != null) {
            properties.getCache().setEnabled(update.getCacheEnabled());
        }
        if (update.getCacheTtlSeconds() != null) {
            properties.getCache().setTtl(
                    Duration.ofSeconds(positive("cache_ttl_seconds", update.getCacheTtlSeconds())));
        }
        if (update.getBatchEnabled() != null) {
            properties.getBatch().setEnabled(update.getBatchEnabled());
        }
        if (update.getBatchConcurrency() != null) {
            properties.getBatch().setConcurrency(
                    (int) positive("batch_concurrency", update.getBatchConcurrency()));
        }
        RuntimeSettings current = current();
        log.info("Runtime settings updated: {}", current);
        return current;
    }

    private static long positive(String field, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
        return value;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RuntimeSettings {
        @JsonProperty("health_check_interval_seconds")
        private Long healthCheckIntervalSeconds;

        @JsonProperty("polling_enabled")
        private Boolean pollingEnabled;

        @JsonProperty("cache_enabled")
        private Boolean cacheEnabled;

        @JsonProperty("cache_ttl_seconds")
        private Long cacheTtlSeconds;

        @JsonProperty("batch_enabled")
        private Boolean batchEnabled;

        @JsonProperty("batch_concurrency")
        private Long batchConcurrency;
    }
}
