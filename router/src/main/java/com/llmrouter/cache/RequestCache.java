package com.llmrouter.cache;

import com.llmrouter.model.AnalysisModels.AnalysisResult;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Fingerprint keyed store of analysis results. Fingerprints are computed by the caller.
 */
public interface RequestCache {

    /**
     * @return the cached result, or empty when absent or expired
     */
    Mono<AnalysisResult> lookup(String fingerprint);

    Mono<Void> store(String fingerprint, AnalysisResult result, Duration ttl);

    /**
     * @return whether an entry was removed
     */
    Mono<Boolean> invalidate(String fingerprint);

    /**
     * @return number of entries removed
     */
    Mono<Long> clear();

    Mono<CacheStats> stats();
}
