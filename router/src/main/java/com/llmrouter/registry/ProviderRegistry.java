package com.llmrouter.registry;

import com.llmrouter.model.HealthStatus;
import com.llmrouter.model.ProviderModels.HealthCheckResult;
import com.llmrouter.model.ProviderModels.UsageStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Source of truth for configured providers. Every mutation is atomic per provider; writes for an
 * id that no longer exists are ignored.
 */
public interface ProviderRegistry {

    /**
     * @param activeOnly skip providers switched off by an operator
     * @return snapshots ordered by id
     */
    List<Provider> list(boolean activeOnly);

    Optional<Provider> get(long id);

    /**
     * Registers a provider. The id on the definition is ignored and a new one is assigned.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    Provider create(ProviderDefinition definition);

    /**
     * @throws com.llmrouter.exception.ProviderNotFoundException if the id is unknown
     */
    Provider update(long id, UnaryOperator<ProviderDefinition> change);

    boolean delete(long id);

    Provider setActive(long id, boolean active);

    void updateHealth(long id, HealthStatus status, Instant checkedAt);

    /**
     * Folds a probe result into the provider's health state and health-check counters.
     */
    void recordHealthCheck(HealthCheckResult result);

    Optional<HealthCheckResult> lastHealthCheck(long id);

    void recordUsage(long id, boolean success, Duration elapsed, String errorMessage);

    Optional<UsageStats> usage(long id);

    List<UsageStats> usage();

    boolean resetStats(long id);

    /**
     * @return number of providers whose stats were cleared
     */
    int resetStats();
}
