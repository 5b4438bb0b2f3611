package com.llmrouter.registry;

import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.exception.ProviderNotFoundException;
import com.llmrouter.model.HealthStatus;
import com.llmrouter.model.ProviderModels.HealthCheckResult;
import com.llmrouter.model.ProviderModels.UsageStats;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Provider table kept in memory and seeded from {@code llm.providers}. Definition edits are
 * serialized on the registry so name uniqueness holds; stats and health writes only lock the
 * row they touch.
 */
@Slf4j
@Component
public class InMemoryProviderRegistry implements ProviderRegistry {

    private final LlmRouterProperties properties;
    private final Clock clock;

    private final Map<Long, ProviderRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final Object definitionLock = new Object();

    public InMemoryProviderRegistry(LlmRouterProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        properties.getProviders().forEach((name, settings) -> {
            if (settings.getApiBase() == null || settings.getApiBase().isBlank()) {
                log.warn("Skipping provider {}: no api-base configured", name);
                return;
            }
            Provider created = create(ProviderDefinition.builder()
                    .name(name)
                    .apiBase(settings.getApiBase())
                    .apiKey(settings.getApiKey())
                    .model(settings.getModel())
                    .priority(settings.getPriority())
                    .active(settings.isActive())
                    .supportsText(settings.isSupportsText())
                    .supportsImage(settings.isSupportsImage())
                    .supportsVideo(settings.isSupportsVideo())
                    .supportsGif(settings.isSupportsGif())
                    .build());
            log.info("Registered provider {} (id={}, priority={}, model={})",
                    created.getName(), created.getId(), created.getPriority(), created.getModel());
        });
    }

    @Override
    public List<Provider> list(boolean activeOnly) {
        return records.values().stream()
                .map(ProviderRecord::toProvider)
                .filter(p -> !activeOnly || p.isActive())
                .sorted(Comparator.comparingLong(Provider::getId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Provider> get(long id) {
        return Optional.ofNullable(records.get(id)).map(ProviderRecord::toProvider);
    }

    @Override
    public Provider create(ProviderDefinition definition) {
        synchronized (definitionLock) {
            requireUniqueName(definition.getName(), null);
            Instant now = clock.instant();
            long id = sequence.incrementAndGet();
            ProviderDefinition stored = definition.toBuilder()
                    .id(id)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            ProviderRecord record = new ProviderRecord(stored, properties.getStats().getEwmaAlpha());
            records.put(id, record);
            return record.toProvider();
        }
    }

    @Override
    public Provider update(long id, UnaryOperator<ProviderDefinition> change) {
        synchronized (definitionLock) {
            ProviderRecord record = require(id);
            ProviderDefinition current = record.getDefinition();
            ProviderDefinition changed = change.apply(current);
            requireUniqueName(changed.getName(), id);
            record.setDefinition(changed.toBuilder()
                    .id(id)
                    .createdAt(current.getCreatedAt())
                    .updatedAt(clock.instant())
                    .build());
            return record.toProvider();
        }
    }

    @Override
    public boolean delete(long id) {
        synchronized (definitionLock) {
            return records.remove(id) != null;
        }
    }

    @Override
    public Provider setActive(long id, boolean active) {
        return update(id, def -> def.toBuilder().active(active).build());
    }

    @Override
    public void updateHealth(long id, HealthStatus status, Instant checkedAt) {
        ProviderRecord record = records.get(id);
        if (record == null) {
            log.debug("Ignoring health update for removed provider {}", id);
            return;
        }
        record.getHealth().update(status, checkedAt);
    }

    @Override
    public void recordHealthCheck(HealthCheckResult result) {
        ProviderRecord record = records.get(result.getProviderId());
        if (record == null) {
            log.debug("Ignoring health check result for removed provider {}", result.getProviderId());
            return;
        }
        record.getHealth().apply(result);
    }

    @Override
    public Optional<HealthCheckResult> lastHealthCheck(long id) {
        return Optional.ofNullable(records.get(id))
                .map(record -> record.getHealth().snapshot().lastResult());
    }

    @Override
    public void recordUsage(long id, boolean success, Duration elapsed, String errorMessage) {
        ProviderRecord record = records.get(id);
        if (record == null) {
            log.debug("Ignoring usage for removed provider {}", id);
            return;
        }
        if (success) {
            record.getStats().recordSuccess(elapsed.toMillis(), clock.instant());
        } else {
            record.getStats().recordError(errorMessage, clock.instant());
        }
    }

    @Override
    public Optional<UsageStats> usage(long id) {
        return Optional.ofNullable(records.get(id)).map(record -> record.getStats().snapshot(id));
    }

    @Override
    public List<UsageStats> usage() {
        return records.values().stream()
                .sorted(Comparator.comparingLong(ProviderRecord::getId))
                .map(record -> record.getStats().snapshot(record.getId()))
                .collect(Collectors.toList());
    }

    @Override
    public boolean resetStats(long id) {
        ProviderRecord record = records.get(id);
        if (record == null) {
            return false;
        }
        record.getStats().reset();
        return true;
    }

    @Override
    public int resetStats() {
        int count = 0;
        for (ProviderRecord record : records.values()) {
            record.getStats().reset();
            count++;
        }
        log.info("Reset usage stats for {} provider(s)", count);
        return count;
    }

    private ProviderRecord require(long id) {
        ProviderRecord record = records.get(id);
        if (record == null) {
            throw new ProviderNotFoundException(id);
        }
        return record;
    }

    private void requireUniqueName(String name, Long exceptId) {
        boolean taken = records.values().stream()
                .anyMatch(r -> r.getDefinition().getName().equalsIgnoreCase(name)
                        && (exceptId == null || r.getId() != exceptId));
        if (taken) {
            throw new IllegalArgumentException("Provider name already exists: " + name);
        }
    }
}
