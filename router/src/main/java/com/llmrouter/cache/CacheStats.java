package com.llmrouter.cache;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
        long entries,
        @JsonProperty("approximate_size_bytes") long approximateSizeBytes,
        long hits,
        long misses,
        @JsonProperty("hit_rate") double hitRate,
        boolean enabled,
        @JsonProperty("ttl_seconds") long ttlSeconds,
        String backend) {

    static double hitRate(long hits, long misses) {
        long total = hits + misses;
        return total == 0 ? 0 : (double) hits / total;
    }
}
