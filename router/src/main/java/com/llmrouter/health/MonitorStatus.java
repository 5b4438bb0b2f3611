package com.llmrouter.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record MonitorStatus(
        boolean running,
        @JsonProperty("polling_enabled") boolean pollingEnabled,
        @JsonProperty("last_run_at") Instant lastRunAt,
        long cycles,
        @JsonProperty("interval_seconds") long intervalSeconds) {
}
