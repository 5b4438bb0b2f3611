package com.llmrouter.health;

import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.model.ProviderModels.HealthCheckResult;
import com.llmrouter.provider.ErrorClassifier;
import com.llmrouter.provider.LlmClient;
import com.llmrouter.registry.Provider;
import com.llmrouter.registry.ProviderRegistry;
import com.llmrouter.requestlog.RequestLog;
import com.llmrouter.requestlog.RequestLogEntry;
import com.llmrouter.requestlog.RequestType;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Probes every active provider on a fixed interval, independent of request traffic, and
 * writes the outcome into the registry. The interval and the polling switch are re-read
 * before every cycle.
 */
@Slf4j
@Service
public class HealthMonitor {

    private final ProviderRegistry registry;
    private final LlmClient client;
    private final LlmRouterProperties properties;
    private final MeterRegistry meterRegistry;
    private final RequestLog requestLog;
    private final Clock clock;

    private final AtomicLong cycles = new AtomicLong();
    private volatile Instant lastRunAt;
    private volatile Disposable loop;

    public HealthMonitor(ProviderRegistry registry, LlmClient client, LlmRouterProperties properties,
                         MeterRegistry meterRegistry, RequestLog requestLog, Clock clock) {
        this.registry = registry;
        this.client = client;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.requestLog = requestLog;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (loop != null && !loop.isDisposed()) {
            log.info("Health monitor already running");
            return;
        }
        loop = Mono.defer(this::scheduledCycle)
                .then(Mono.defer(() -> Mono.delay(properties.getHealth().getInterval())))
                .repeat()
                .subscribe(
                        tick -> { },
                        error -> log.error("Health monitor loop terminated", error));
        log.info("Health monitor started, interval={}s", properties.getHealth().getInterval().toSeconds());
    }

    @PreDestroy
    public synchronized void stop() {
        if (loop != null) {
            loop.dispose();
            loop = null;
            log.info("Health monitor stopped");
        }
    }

    /**
     * Administrative trigger. Runs a full cycle right away without touching the periodic schedule.
     */
    public Mono<List<HealthCheckResult>> runNow() {
        log.info("Manual health check requested");
        return runChecks();
    }

    public List<HealthCheckResult> lastResults() {
        return registry.list(false).stream()
                .map(provider -> registry.lastHealthCheck(provider.getId()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    public MonitorStatus status() {
        Disposable current = loop;
        LlmRouterProperties.HealthSettings health = properties.getHealth();
        return new MonitorStatus(current != null && !current.isDisposed(), health.isPollingEnabled(),
                lastRunAt, cycles.get(), health.getInterval().toSeconds());
    }

    private Mono<Void> scheduledCycle() {
        if (!properties.getHealth().isPollingEnabled()) {
            log.debug("Polling disabled, skipping health check cycle");
            return Mono.empty();
        }
        return runChecks()
                .doOnNext(results -> log.info("Health check cycle finished: {} provider(s), {} failed",
                        results.size(), results.stream().filter(r -> !r.isSuccess()).count()))
                .onErrorResume(e -> {
                    log.error("Health check cycle failed", e);
                    return Mono.empty();
                })
                .then();
    }

    private Mono<List<HealthCheckResult>> runChecks() {
        return Mono.defer(() -> {
            List<Provider> providers = registry.list(true);
            log.info("Running health check for {} active provider(s)", providers.size());
            return Flux.fromIterable(providers)
                    .flatMap(this::probe, Math.max(1, properties.getHealth().getProbeConcurrency()))
                    .sort(Comparator.comparingLong(HealthCheckResult::getProviderId))
                    .collectList()
                    .doOnNext(results -> {
                        cycles.incrementAndGet();
                        lastRunAt = clock.instant();
                    });
        });
    }

    private Mono<HealthCheckResult> probe(Provider provider) {
        LlmRouterProperties.HealthSettings health = properties.getHealth();
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return client.probe(provider, health.getProbePrompt())
                    .timeout(health.getProbeTimeout())
                    .then(Mono.fromSupplier(() -> result(provider, true, elapsedMs(start), null)))
                    .onErrorResume(e -> {
                        ProviderCallException failure = ErrorClassifier.classify(provider, e);
                        requestLog.record(logEntry(provider, elapsedMs(start))
                                .success(false)
                                .errorType(failure.getCategory().getCode())
                                .errorMessage(failure.getMessage())
                                .build());
                        return Mono.just(result(provider, false, elapsedMs(start),
                                "[" + failure.getCategory().getCode() + "] " + failure.getMessage()));
                    });
        }).doOnNext(result -> {
            if (result.isSuccess()) {
                requestLog.record(logEntry(provider, result.getResponseTimeMs()).success(true).build());
            }
            registry.recordHealthCheck(result);
            meterRegistry.counter("llm.health.checks", "provider", provider.getName(),
                    "status", result.isSuccess() ? "success" : "failure").increment();
            if (result.isSuccess()) {
                log.info("Health check passed: provider={}, model={}, time={}ms",
                        provider.getName(), provider.getModel(), result.getResponseTimeMs());
            } else {
                log.warn("Health check failed: provider={}, model={}, error={}",
                        provider.getName(), provider.getModel(), result.getErrorMessage());
            }
        });
    }

    private static RequestLogEntry.RequestLogEntryBuilder logEntry(Provider provider, long responseTimeMs) {
        return RequestLogEntry.builder()
                .providerId(provider.getId())
                .providerName(provider.getName())
                .requestType(RequestType.HEALTH_CHECK)
                .responseTimeMs(responseTimeMs);
    }

    private HealthCheckResult result(Provider provider, boolean success, long responseTimeMs, String error) {
        return HealthCheckResult.builder()
                .providerId(provider.getId())
                .providerName(provider.getName())
                .success(success)
                .responseTimeMs(responseTimeMs)
                .errorMessage(error)
                .checkedAt(clock.instant())
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
