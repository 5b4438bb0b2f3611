package com.llmrouter.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.model.AnalysisModels.AnalysisResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local cache with its own TTL handling. Reads are lock-free; an expired entry is
 * removed by the reader that finds it, and bulk purging only happens on writes past
 * {@code llm.cache.max-entries}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "llm.cache", name = "backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryRequestCache implements RequestCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    private final LlmRouterProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public InMemoryRequestCache(LlmRouterProperties properties, ObjectMapper objectMapper,
                                MeterRegistry meterRegistry, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @Override
    public Mono<AnalysisResult> lookup(String fingerprint) {
        return Mono.fromSupplier(() -> {
            CacheEntry entry = entries.get(fingerprint);
            if (entry != null && entry.isExpired(clock.instant())) {
                entries.remove(fingerprint, entry);
                entry = null;
            }
            if (entry == null) {
                misses.incrementAndGet();
                meterRegistry.counter("llm.cache", "status", "miss").increment();
                return null;
            }
            hits.incrementAndGet();
            meterRegistry.counter("llm.cache", "status", "hit").increment();
            log.debug("Cache hit for key: {}", fingerprint);
            return entry.result();
        });
    }

    @Override
    public Mono<Void> store(String fingerprint, AnalysisResult result, Duration ttl) {
        return Mono.fromRunnable(() -> {
            entries.put(fingerprint, new CacheEntry(fingerprint, result, clock.instant(), ttl, sizeOf(result)));
            log.debug("Cached response for key: {}", fingerprint);
            if (entries.size() > properties.getCache().getMaxEntries()) {
                shrink();
            }
        });
    }

    @Override
    public Mono<Boolean> invalidate(String fingerprint) {
        return Mono.fromSupplier(() -> entries.remove(fingerprint) != null);
    }

    @Override
    public Mono<Long> clear() {
        return Mono.fromSupplier(() -> {
            long removed = 0;
            for (String key : entries.keySet()) {
                if (entries.remove(key) != null) {
                    removed++;
                }
            }
            log.info("Cleared {} cache entries", removed);
            return removed;
        });
    }

    @Override
    public Mono<CacheStats> stats() {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            long count = 0;
            long bytes = 0;
            for (CacheEntry entry : entries.values()) {
                if (!entry.isExpired(now)) {
                    count++;
                    bytes += entry.approximateSizeBytes();
                }
            }
            long hitCount = hits.get();
            long missCount = misses.get();
            LlmRouterProperties.CacheSettings settings = properties.getCache();
            return new CacheStats(count, bytes, hitCount, missCount, CacheStats.hitRate(hitCount, missCount),
                    settings.isEnabled(), settings.getTtl().toSeconds(), "memory");
        });
    }

    int size() {
        return entries.size();
    }

    private void shrink() {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(now));

        int overflow = entries.size() - properties.getCache().getMaxEntries();
        if (overflow > 0) {
            entries.values().stream()
                    .sorted(Comparator.comparing(CacheEntry::createdAt))
                    .limit(overflow)
                    .forEach(entry -> entries.remove(entry.fingerprint(), entry));
            log.debug("Evicted {} oldest cache entries", overflow);
        }
    }

    private long sizeOf(AnalysisResult result) {
        try {
            return objectMapper.writeValueAsBytes(result).length;
        } catch (JsonProcessingException e) {
            log.debug("Could not measure cached result size: {}", e.getMessage());
            return 0;
        }
    }
}
