package com.llmrouter.registry;

import com.llmrouter.model.HealthStatus;
import com.llmrouter.model.MediaType;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a provider: configuration, last known health and usage stats.
 * Selection and dispatch work on these snapshots, never on the live record.
 */
@Value
@Builder(toBuilder = true)
public class Provider {
    long id;
    String name;
    String apiBase;
    @ToString.Exclude
    String apiKey;
    String model;
    int priority;
    boolean active;
    boolean supportsText;
    boolean supportsImage;
    boolean supportsVideo;
    boolean supportsGif;

    @Builder.Default
    HealthStatus healthStatus = HealthStatus.UNKNOWN;
    Instant lastCheckedAt;
    long healthCheckCount;
    long healthFailureCount;

    long usageCount;
    long successCount;
    long errorCount;
    double avgResponseTimeMs;

    public boolean supports(MediaType mediaType) {
        switch (mediaType) {
            case TEXT:
                return supportsText;
            case IMAGE:
                return supportsImage;
            case VIDEO:
                return supportsVideo;
            case GIF:
                return supportsGif;
            default:
                return false;
        }
    }
}
