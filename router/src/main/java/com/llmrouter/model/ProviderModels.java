package com.llmrouter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

public class ProviderModels {

    /**
     * Create/update payload. The API key is write-only; it never appears in a response.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ProviderRequest {
        @NotBlank(message = "Name cannot be blank")
        @Size(max = 100)
        private String name;

        @NotBlank(message = "API base cannot be blank")
        @JsonProperty("api_base")
        private String apiBase;

        @ToString.Exclude
        @JsonProperty(value = "api_key", access = JsonProperty.Access.WRITE_ONLY)
        private String apiKey;

        @NotBlank(message = "Model cannot be blank")
        private String model;

        @Min(0)
        private Integer priority;

        @JsonProperty("is_active")
        private Boolean active;

        @JsonProperty("supports_text")
        private Boolean supportsText;

        @JsonProperty("supports_image")
        private Boolean supportsImage;

        @JsonProperty("supports_video")
        private Boolean supportsVideo;

        @JsonProperty("supports_gif")
        private Boolean supportsGif;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProviderView {
        private Long id;
        private String name;

        @JsonProperty("api_base")
        private String apiBase;

        private String model;
        private Integer priority;

        @JsonProperty("is_active")
        private Boolean active;

        @JsonProperty("supports_text")
        private Boolean supportsText;

        @JsonProperty("supports_image")
        private Boolean supportsImage;

        @JsonProperty("supports_video")
        private Boolean supportsVideo;

        @JsonProperty("supports_gif")
        private Boolean supportsGif;

        @JsonProperty("api_key_configured")
        private Boolean apiKeyConfigured;

        @JsonProperty("health_status")
        private HealthStatus healthStatus;

        @JsonProperty("last_checked_at")
        private Instant lastCheckedAt;

        @JsonProperty("health_check_count")
        private Long healthCheckCount;

        @JsonProperty("health_failure_count")
        private Long healthFailureCount;

        @JsonProperty("last_health_check")
        private HealthCheckResult lastHealthCheck;

        private UsageStats stats;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HealthCheckResult {
        @JsonProperty("provider_id")
        long providerId;

        @JsonProperty("provider_name")
        String providerName;

        @JsonProperty("is_success")
        boolean success;

        @JsonProperty("response_time_ms")
        long responseTimeMs;

        @JsonProperty("error_message")
        String errorMessage;

        @JsonProperty("checked_at")
        Instant checkedAt;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class UsageStats {
        @JsonProperty("provider_id")
        long providerId;

        @JsonProperty("usage_count")
        long usageCount;

        @JsonProperty("success_count")
        long successCount;

        @JsonProperty("error_count")
        long errorCount;

        @JsonProperty("avg_response_time_ms")
        double avgResponseTimeMs;

        @JsonProperty("last_error")
        String lastError;

        @JsonProperty("last_used_at")
        Instant lastUsedAt;

        @JsonProperty("last_error_at")
        Instant lastErrorAt;
    }
}
