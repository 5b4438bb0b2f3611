package com.llmrouter.stats;

import com.llmrouter.model.ProviderModels.UsageStats;

import java.time.Instant;

/**
 * Usage counters for one provider. Every method holds the instance lock, so a reset or a
 * snapshot never observes a half-applied update.
 */
public class ProviderStats {

    private final double alpha;

    private long usageCount;
    private long successCount;
    private long errorCount;
    private double avgResponseTimeMs;
    private String lastError;
    private Instant lastUsedAt;
    private Instant lastErrorAt;

    public ProviderStats(double alpha) {
        if (alpha <= 0 || alpha > 1) {
            throw new IllegalArgumentException("EWMA alpha must be in (0, 1]: " + alpha);
        }
        this.alpha = alpha;
    }

    public synchronized void recordSuccess(long elapsedMs, Instant at) {
        usageCount++;
        // first sample seeds the average
        avgResponseTimeMs = successCount == 0
                ? elapsedMs
                : alpha * elapsedMs + (1 - alpha) * avgResponseTimeMs;
        successCount++;
        lastUsedAt = at;
    }

    public synchronized void recordError(String message, Instant at) {
        usageCount++;
        errorCount++;
        lastError = message;
        lastErrorAt = at;
        lastUsedAt = at;
    }

    public synchronized void reset() {
        usageCount = 0;
        successCount = 0;
        errorCount = 0;
        avgResponseTimeMs = 0;
        lastError = null;
        lastUsedAt = null;
        lastErrorAt = null;
    }

    public synchronized UsageStats snapshot(long providerId) {
        return UsageStats.builder()
                .providerId(providerId)
                .usageCount(usageCount)
                .successCount(successCount)
                .errorCount(errorCount)
                .avgResponseTimeMs(avgResponseTimeMs)
                .lastError(lastError)
                .lastUsedAt(lastUsedAt)
                .lastErrorAt(lastErrorAt)
                .build();
    }
}
