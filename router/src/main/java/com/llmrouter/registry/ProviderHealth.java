package com.llmrouter.registry;

import com.llmrouter.model.HealthStatus;
import com.llmrouter.model.ProviderModels.HealthCheckResult;

import java.time.Instant;

/**
 * Health state written by the monitor. Guarded by the instance lock.
 */
class ProviderHealth {

    private HealthStatus status = HealthStatus.UNKNOWN;
    private Instant lastCheckedAt;
    private long checkCount;
    private long failureCount;
    private HealthCheckResult lastResult;

    synchronized void update(HealthStatus status, Instant checkedAt) {
        this.status = status;
        this.lastCheckedAt = checkedAt;
    }

    synchronized void apply(HealthCheckResult result) {
        checkCount++;
        if (!result.isSuccess()) {
            failureCount++;
        }
        lastResult = result;
        update(result.isSuccess() ? HealthStatus.AVAILABLE : HealthStatus.UNAVAILABLE, result.getCheckedAt());
    }

    synchronized Snapshot snapshot() {
        return new Snapshot(status, lastCheckedAt, checkCount, failureCount, lastResult);
    }

    record Snapshot(HealthStatus status, Instant lastCheckedAt, long checkCount, long failureCount,
                    HealthCheckResult lastResult) {}
}
