package com.llmrouter.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.model.AnalysisModels.AnalysisResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache shared across instances. Expiry is delegated to Redis key TTLs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "llm.cache", name = "backend", havingValue = "redis")
public class RedisRequestCache implements RequestCache {

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LlmRouterProperties properties;
    private final MeterRegistry meterRegistry;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Override
    public Mono<AnalysisResult> lookup(String fingerprint) {
        String cacheKey = key(fingerprint);

        return redisTemplate.opsForValue().get(cacheKey)
                .flatMap(cached -> {
                    try {
                        AnalysisResult result = objectMapper.readValue(cached, AnalysisResult.class);
                        hits.incrementAndGet();
                        meterRegistry.counter("llm.cache", "status", "hit").increment();
                        log.debug("Cache hit for key: {}", cacheKey);
                        return Mono.just(result);
                    } catch (JsonProcessingException e) {
                        log.error("Failed to deserialize cached result for key {}", cacheKey, e);
                        return Mono.empty();
                    }
                })
                .switchIfEmpty(Mono.defer(() -> {
                    misses.incrementAndGet();
                    meterRegistry.counter("llm.cache", "status", "miss").increment();
                    return Mono.empty();
                }));
    }

    @Override
    public Mono<Void> store(String fingerprint, AnalysisResult result, Duration ttl) {
        String cacheKey = key(fingerprint);
        String serialized;
        try {
            serialized = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize result for caching", e));
        }

        return redisTemplate.opsForValue().set(cacheKey, serialized, ttl)
                .doOnSuccess(success -> log.debug("Cached response for key: {}", cacheKey))
                .then();
    }

    @Override
    public Mono<Boolean> invalidate(String fingerprint) {
        return redisTemplate.delete(key(fingerprint)).map(count -> count > 0);
    }

    @Override
    public Mono<Long> clear() {
        return scanKeys()
                .flatMap(redisTemplate::delete)
                .reduce(0L, Long::sum)
                .doOnSuccess(count -> log.info("Cleared {} cache entries", count));
    }

    @Override
    public Mono<CacheStats> stats() {
        return scanKeys()
                .flatMap(cacheKey -> redisTemplate.opsForValue().size(cacheKey))
                .reduceWith(() -> new long[2], (acc, size) -> {
                    acc[0]++;
                    acc[1] += size;
                    return acc;
                })
                .map(acc -> {
                    long hitCount = hits.get();
                    long missCount = misses.get();
                    LlmRouterProperties.CacheSettings settings = properties.getCache();
                    return new CacheStats(acc[0], acc[1], hitCount, missCount,
                            CacheStats.hitRate(hitCount, missCount),
                            settings.isEnabled(), settings.getTtl().toSeconds(), "redis");
                });
    }

    private Flux<String> scanKeys() {
        return redisTemplate.scan(ScanOptions.scanOptions()
                .match(properties.getCache().getKeyPrefix() + "*")
                .count(500)
                .build());
    }

    private String key(String fingerprint) {
        return properties.getCache().getKeyPrefix() + fingerprint;
    }
}
