package com.llmrouter.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.model.AnalysisModels.AnalysisResult;
import com.llmrouter.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRequestCacheTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private LlmRouterProperties properties;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryRequestCache cache;

    @BeforeEach
    void setUp() {
        properties = new LlmRouterProperties();
        clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        cache = new InMemoryRequestCache(properties, new ObjectMapper(), meterRegistry, clock);
    }

    @Test
    void returnsStoredResultUntilTtlElapses() {
        cache.store("fp-1", result("first"), TTL).block();

        clock.advance(TTL.minusSeconds(1));
        StepVerifier.create(cache.lookup("fp-1"))
                .assertNext(result -> assertEquals("first", result.getSummary()))
                .verifyComplete();

        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(cache.lookup("fp-1")).verifyComplete();
        assertEquals(0, cache.size());
    }

    @Test
    void countsHitsAndMisses() {
        cache.store("fp-1", result("first"), TTL).block();

        cache.lookup("fp-1").block();
        cache.lookup("fp-1").block();
        cache.lookup("missing").block();

        StepVerifier.create(cache.stats())
                .assertNext(stats -> {
                    assertEquals(1, stats.entries());
                    assertEquals(2, stats.hits());
                    assertEquals(1, stats.misses());
                    assertEquals(2.0 / 3, stats.hitRate(), 1e-9);
                    assertTrue(stats.approximateSizeBytes() > 0);
                    assertEquals("memory", stats.backend());
                    assertEquals(3600, stats.ttlSeconds());
                })
                .verifyComplete();
        assertEquals(2.0, meterRegistry.counter("llm.cache", "status", "hit").count());
    }

    @Test
    void statsIgnoreExpiredEntries() {
        cache.store("short", result("short"), Duration.ofSeconds(5)).block();
        cache.store("long", result("long"), TTL).block();

        clock.advance(Duration.ofSeconds(6));

        StepVerifier.create(cache.stats())
                .assertNext(stats -> assertEquals(1, stats.entries()))
                .verifyComplete();
    }

    @Test
    void invalidateRemovesSingleEntry() {
        cache.store("fp-1", result("first"), TTL).block();

        StepVerifier.create(cache.invalidate("fp-1")).expectNext(true).verifyComplete();
        StepVerifier.create(cache.invalidate("fp-1")).expectNext(false).verifyComplete();
        StepVerifier.create(cache.lookup("fp-1")).verifyComplete();
    }

    @Test
    void clearReportsRemovedCount() {
        cache.store("a", result("a"), TTL).block();
        cache.store("b", result("b"), TTL).block();
        cache.store("c", result("c"), TTL).block();

        StepVerifier.create(cache.clear()).expectNext(3L).verifyComplete();
        assertEquals(0, cache.size());
    }

    @Test
    void evictsOldestEntriesPastCapacity() {
        properties.getCache().setMaxEntries(2);

        cache.store("oldest", result("oldest"), TTL).block();
        clock.advance(Duration.ofSeconds(1));
        cache.store("middle", result("middle"), TTL).block();
        clock.advance(Duration.ofSeconds(1));
        cache.store("newest", result("newest"), TTL).block();

        assertEquals(2, cache.size());
        StepVerifier.create(cache.lookup("oldest")).verifyComplete();
        StepVerifier.create(cache.lookup("newest"))
                .assertNext(result -> assertEquals("newest", result.getSummary()))
                .verifyComplete();
    }

    private static AnalysisResult result(String summary) {
        return AnalysisResult.builder()
                .shouldPush(true)
                .confidence(70)
                .summary(summary)
                .providerId(1L)
                .providerName("primary")
                .attempts(1)
                .build();
    }
}
