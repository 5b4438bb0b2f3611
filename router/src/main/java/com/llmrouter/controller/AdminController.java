package com.llmrouter.controller;

import com.llmrouter.cache.CacheStats;
import com.llmrouter.cache.RequestCache;
import com.llmrouter.exception.ProviderNotFoundException;
import com.llmrouter.health.HealthMonitor;
import com.llmrouter.model.ProviderModels.HealthCheckResult;
import com.llmrouter.model.ProviderModels.UsageStats;
import com.llmrouter.notify.NotificationServer;
import com.llmrouter.notify.NotificationServerSource;
import com.llmrouter.registry.ProviderRegistry;
import com.llmrouter.requestlog.RequestLog;
import com.llmrouter.requestlog.RequestLogEntry;
import com.llmrouter.requestlog.RequestType;
import com.llmrouter.service.SettingsService;
import com.llmrouter.service.SettingsService.RuntimeSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AdminController {

    private final ProviderRegistry registry;
    private final HealthMonitor healthMonitor;
    private final RequestCache requestCache;
    private final SettingsService settingsService;
    private final NotificationServerSource notificationServerSource;
    private final RequestLog requestLog;
    private final Clock clock;

    /**
     * Liveness of the router itself, not of its providers.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of(
                "status", "healthy",
                "timestamp", clock.instant().toString(),
                "service", "llm-router",
                "active_providers", registry.list(true).size()
        )));
    }

    @GetMapping("/admin/health")
    public ResponseEntity<Map<String, Object>> healthStatus() {
        return ResponseEntity.ok(Map.of(
                "monitor", healthMonitor.status(),
                "results", healthMonitor.lastResults()
        ));
    }

    @PostMapping("/admin/health/run")
    public Mono<ResponseEntity<List<HealthCheckResult>>> runHealthChecks() {
        return healthMonitor.runNow().map(ResponseEntity::ok);
    }

    @GetMapping("/admin/cache")
    public Mono<ResponseEntity<CacheStats>> cacheStats() {
        return requestCache.stats().map(ResponseEntity::ok);
    }

    @DeleteMapping("/admin/cache")
    public Mono<ResponseEntity<Map<String, Object>>> clearCache() {
        return requestCache.clear()
                .map(count -> {
                    log.info("Cache cleared: {} entries", count);
                    return ResponseEntity.ok(Map.of(
                            "status", "success",
                            "cleared", count
                    ));
                });
    }

    @DeleteMapping("/admin/cache/{fingerprint}")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateCacheEntry(@PathVariable String fingerprint) {
        return requestCache.invalidate(fingerprint)
                .map(removed -> ResponseEntity.ok(Map.of(
                        "status", "success",
                        "fingerprint", fingerprint,
                        "removed", removed
                )));
    }

    @GetMapping("/admin/stats")
    public ResponseEntity<List<UsageStats>> stats() {
        return ResponseEntity.ok(registry.usage());
    }

    @DeleteMapping("/admin/stats")
    public ResponseEntity<Map<String, Object>> resetStats() {
        int reset = registry.resetStats();
        log.info("Usage stats reset for {} provider(s)", reset);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "reset", reset
        ));
    }

    @DeleteMapping("/admin/stats/{id}")
    public ResponseEntity<Map<String, Object>> resetStats(@PathVariable long id) {
        if (!registry.resetStats(id)) {
            throw new ProviderNotFoundException(id);
        }
        log.info("Usage stats reset for provider {}", id);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "id", id
        ));
    }

    /**
     * Recent provider calls, cache hits and health probes, newest first.
     */
    @GetMapping("/admin/logs")
    public ResponseEntity<List<RequestLogEntry>> requestLogs(
            @RequestParam(name = "provider_id", required = false) Long providerId,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        if (limit < 1 || limit > 1000) {
            throw new IllegalArgumentException("limit must be between 1 and 1000");
        }
        RequestType requestType = type != null ? RequestType.fromValue(type) : null;
        return ResponseEntity.ok(requestLog.recent(providerId, requestType, limit));
    }

    @DeleteMapping("/admin/logs")
    public ResponseEntity<Map<String, Object>> clearRequestLogs(
            @RequestParam(name = "provider_id", required = false) Long providerId) {
        Map<String, Object> body = new HashMap<>();
        body.put("status", "success");
        body.put("cleared", requestLog.clear(providerId));
        if (providerId != null) {
            body.put("provider_id", providerId);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/admin/settings")
    public ResponseEntity<RuntimeSettings> settings() {
        return ResponseEntity.ok(settingsService.current());
    }

    @PutMapping("/admin/settings")
    public ResponseEntity<RuntimeSettings> updateSettings(@RequestBody RuntimeSettings update) {
        return ResponseEntity.ok(settingsService.update(update));
    }

    @GetMapping("/admin/notifications/servers")
    public ResponseEntity<List<NotificationServer>> notificationServers() {
        return ResponseEntity.ok(notificationServerSource.listServers());
    }
}
