package com.llmrouter.registry;

import com.llmrouter.model.ProviderModels.UsageStats;
import com.llmrouter.stats.ProviderStats;

/**
 * Live registry row. The definition is swapped atomically on edit; stats and health carry
 * their own locks so dispatch and health writers never contend with each other.
 */
class ProviderRecord {

    private final long id;
    private volatile ProviderDefinition definition;
    private final ProviderStats stats;
    private final ProviderHealth health = new ProviderHealth();

    ProviderRecord(ProviderDefinition definition, double ewmaAlpha) {
        this.id = definition.getId();
        this.definition = definition;
        this.stats = new ProviderStats(ewmaAlpha);
    }

    long getId() {
        return id;
    }

    ProviderDefinition getDefinition() {
        return definition;
    }

    void setDefinition(ProviderDefinition definition) {
        this.definition = definition;
    }

    ProviderStats getStats() {
        return stats;
    }

    ProviderHealth getHealth() {
        return health;
    }

    Provider toProvider() {
        ProviderDefinition def = definition;
        ProviderHealth.Snapshot healthSnapshot = health.snapshot();
        UsageStats usage = stats.snapshot(id);
        return Provider.builder()
                .id(id)
                .name(def.getName())
                .apiBase(def.getApiBase())
                .apiKey(def.getApiKey())
                .model(def.getModel())
                .priority(def.getPriority())
                .active(def.isActive())
                .supportsText(def.isSupportsText())
                .supportsImage(def.isSupportsImage())
                .supportsVideo(def.isSupportsVideo())
                .supportsGif(def.isSupportsGif())
                .healthStatus(healthSnapshot.status())
                .lastCheckedAt(healthSnapshot.lastCheckedAt())
                .healthCheckCount(healthSnapshot.checkCount())
                .healthFailureCount(healthSnapshot.failureCount())
                .usageCount(usage.getUsageCount())
                .successCount(usage.getSuccessCount())
                .errorCount(usage.getErrorCount())
                .avgResponseTimeMs(usage.getAvgResponseTimeMs())
                .build();
    }
}
