package com.llmrouter.cache;

import com.llmrouter.model.AnalysisModels.AnalysisResult;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cached result. Expired entries count as absent even before they are purged.
 */
public record CacheEntry(String fingerprint, AnalysisResult result, Instant createdAt, Duration ttl,
                         long approximateSizeBytes) {

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
