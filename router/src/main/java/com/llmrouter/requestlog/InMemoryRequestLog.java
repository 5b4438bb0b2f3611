package com.llmrouter.requestlog;

import com.llmrouter.config.LlmRouterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-process log. New entries go to the head, so the tail always holds the oldest
 * ones and pruning only ever walks from there.
 */
@Slf4j
@Component
public class InMemoryRequestLog implements RequestLog {

    private final ConcurrentLinkedDeque<RequestLogEntry> entries = new ConcurrentLinkedDeque<>();
    private final AtomicInteger size = new AtomicInteger();
    private final AtomicLong ids = new AtomicLong();

    private final LlmRouterProperties properties;
    private final Clock clock;

    public InMemoryRequestLog(LlmRouterProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void record(RequestLogEntry entry) {
        if (!properties.getRequestLog().isEnabled()) {
            return;
        }
        entries.addFirst(entry.toBuilder()
                .id(ids.incrementAndGet())
                .createdAt(clock.instant())
                .build());
        size.incrementAndGet();

        int maxEntries = Math.max(1, properties.getRequestLog().getMaxEntries());
        while (size.get() > maxEntries && entries.pollLast() != null) {
            size.decrementAndGet();
        }
        prune();
    }

    @Override
    public List<RequestLogEntry> recent(Long providerId, RequestType type, int limit) {
        prune();
        List<RequestLogEntry> matches = new ArrayList<>();
        for (RequestLogEntry entry : entries) {
            if (matches.size() >= limit) {
                break;
            }
            if ((providerId == null || providerId.equals(entry.getProviderId()))
                    && (type == null || type == entry.getRequestType())) {
                matches.add(entry);
            }
        }
        return matches;
    }

    @Override
    public int prune() {
        Instant cutoff = clock.instant().minus(properties.getRequestLog().getRetention());
        int dropped = 0;
        RequestLogEntry oldest;
        while ((oldest = entries.peekLast()) != null && oldest.getCreatedAt().isBefore(cutoff)) {
            if (entries.removeLastOccurrence(oldest)) {
                size.decrementAndGet();
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Pruned {} request log entries older than {}", dropped, cutoff);
        }
        return dropped;
    }

    @Override
    public int clear(Long providerId) {
        int removed = 0;
        for (RequestLogEntry entry : entries) {
            if ((providerId == null || Objects.equals(providerId, entry.getProviderId()))
                    && entries.removeFirstOccurrence(entry)) {
                size.decrementAndGet();
                removed++;
            }
        }
        log.info("Request log cleared: {} entries{}", removed, providerId != null ? " for provider " + providerId : "");
        return removed;
    }
}
