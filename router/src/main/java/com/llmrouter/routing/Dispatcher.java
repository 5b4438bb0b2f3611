package com.llmrouter.routing;

import com.llmrouter.cache.Fingerprint;
import com.llmrouter.cache.RequestCache;
import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.exception.ErrorCategory;
import com.llmrouter.exception.LlmRoutingException;
import com.llmrouter.exception.NoEligibleProviderException;
import com.llmrouter.exception.ProviderCallException;
import com.llmrouter.exception.ProvidersExhaustedException;
import com.llmrouter.model.AnalysisModels.AnalysisRequest;
import com.llmrouter.model.AnalysisModels.AnalysisResult;
import com.llmrouter.model.AnalysisModels.BatchItemResult;
import com.llmrouter.model.MediaType;
import com.llmrouter.provider.Completion;
import com.llmrouter.provider.ErrorClassifier;
import com.llmrouter.provider.LlmClient;
import com.llmrouter.registry.Provider;
import com.llmrouter.registry.ProviderRegistry;
import com.llmrouter.requestlog.RequestLog;
import com.llmrouter.requestlog.RequestLogEntry;
import com.llmrouter.requestlog.RequestType;
import com.llmrouter.stats.StatsTracker;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for content analysis: cache first, then providers in selector order, one at a
 * time, until one answers with a usable result or the attempt budget or deadline runs out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Dispatcher {

    private final ProviderRegistry registry;
    private final Selector selector;
    private final RequestCache cache;
    private final LlmClient client;
    private final StatsTracker statsTracker;
    private final AnalysisResponseParser parser;
    private final LlmRouterProperties properties;
    private final MeterRegistry meterRegistry;
    private final RequestLog requestLog;

    public Mono<AnalysisResult> analyze(AnalysisRequest request) {
        return analyze(request.getContent(), request.getMediaType(), request.getPromptTemplate());
    }

    public Mono<AnalysisResult> analyze(String content, MediaType mediaType, String promptTemplate) {
        MediaType type = mediaType != null ? mediaType : MediaType.TEXT;
        return Mono.defer(() -> {
            String prompt = PromptRenderer.render(promptTemplate, content);
            String fingerprint = Fingerprint.of(content, type, promptTemplate);

            return cachedResult(fingerprint)
                    .switchIfEmpty(Mono.defer(() -> route(fingerprint, prompt, type)));
        });
    }

    /**
     * Runs every request through {@link #analyze(AnalysisRequest)} and reports one item per
     * request in input order. Failed items carry the error instead of failing the batch.
     */
    public Flux<BatchItemResult> analyzeBatch(List<AnalysisRequest> requests) {
        LlmRouterProperties.BatchSettings batch = properties.getBatch();
        Function<Integer, Mono<BatchItemResult>> runItem = index -> analyze(requests.get(index))
                .map(result -> BatchItemResult.builder().index(index).result(result).build())
                .onErrorResume(e -> Mono.just(failedItem(index, e)));

        Flux<Integer> indexes = Flux.range(0, requests.size());
        if (batch.isEnabled()) {
            return indexes.flatMapSequential(runItem, Math.max(1, batch.getConcurrency()));
        }
        return indexes.concatMap(runItem);
    }

    private Mono<AnalysisResult> cachedResult(String fingerprint) {
        if (!properties.getCache().isEnabled()) {
            return Mono.empty();
        }
        return cache.lookup(fingerprint)
                .map(result -> result.toBuilder().cached(true).build())
                .doOnNext(result -> requestLog.record(RequestLogEntry.builder()
                        .providerId(result.getProviderId())
                        .providerName(result.getProviderName())
                        .requestType(RequestType.CONTENT_ANALYSIS)
                        .success(true)
                        .responseTimeMs(0L)
                        .cached(true)
                        .cacheKey(fingerprint)
                        .build()))
                .onErrorResume(e -> {
                    log.warn("Cache lookup failed for {}: {}", fingerprint, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<AnalysisResult> route(String fingerprint, String prompt, MediaType mediaType) {
        List<Provider> candidates = selector.select(registry.list(true), mediaType);
        if (candidates.isEmpty()) {
            log.error("No eligible provider for media type {}", mediaType.getValue());
            return Mono.error(new NoEligibleProviderException(mediaType));
        }

        log.info("Routing {} request: candidates={}", mediaType.getValue(),
                candidates.stream().map(Provider::getName).collect(Collectors.toList()));

        LlmRouterProperties.RoutingSettings routing = properties.getRouting();
        AttemptBudget budget = new AttemptBudget(routing.getMaxAttempts());

        return tryCandidates(candidates, 0, fingerprint, prompt, budget)
                .timeout(routing.getRequestTimeout(),
                        Mono.defer(() -> Mono.error(budget.exhausted("request deadline exceeded"))))
                .flatMap(result -> remember(fingerprint, result))
                .doOnError(ProvidersExhaustedException.class,
                        e -> log.error("Analysis failed: {}", e.getMessage()));
    }

    private Mono<AnalysisResult> tryCandidates(List<Provider> candidates, int index, String fingerprint,
                                               String prompt, AttemptBudget budget) {
        if (index >= candidates.size()) {
            return Mono.error(budget.exhausted("all candidates failed"));
        }
        if (!budget.hasRemaining()) {
            return Mono.error(budget.exhausted("attempt budget spent"));
        }

        Provider provider = candidates.get(index);
        return attempt(provider, fingerprint, prompt, budget, properties.getRouting().isParseRetryEnabled())
                .onErrorResume(ProviderCallException.class, e -> {
                    log.warn("Provider {} failed [{}, {}]: {}", provider.getName(), e.getCategory().getCode(),
                            e.getCategory().isRetryable() ? "transient" : "permanent", e.getMessage());
                    meterRegistry.counter("llm.routing.failover",
                            "from", provider.getName(), "category", e.getCategory().getCode()).increment();
                    return tryCandidates(candidates, index + 1, fingerprint, prompt, budget);
                });
    }

    private Mono<AnalysisResult> attempt(Provider provider, String fingerprint, String prompt,
                                         AttemptBudget budget, boolean allowParseRetry) {
        return Mono.defer(() -> {
            budget.consume();
            long start = System.nanoTime();

            return client.complete(provider, prompt, properties.getRouting().getAttemptTimeout())
                    .switchIfEmpty(Mono.error(() -> new ProviderCallException(ErrorCategory.PARSE,
                            provider.getId(), provider.getName(), "Empty response")))
                    .map(completion -> {
                        AnalysisResult result = toResult(provider, completion.getContent(), budget);
                        logCall(provider, fingerprint, elapsedMs(start), completion, null);
                        return result;
                    })
                    .onErrorMap(e -> !(e instanceof ProviderCallException), e -> ErrorClassifier.classify(provider, e))
                    .doOnNext(result -> statsTracker.recordSuccess(provider, elapsedMs(start)))
                    .doOnCancel(() -> {
                        ProviderCallException cancelled = new ProviderCallException(ErrorCategory.TIMEOUT,
                                provider.getId(), provider.getName(), "Attempt cancelled by request deadline");
                        statsTracker.recordError(provider, cancelled);
                        budget.recordFailure(cancelled);
                        logCall(provider, fingerprint, elapsedMs(start), null, cancelled);
                    })
                    .onErrorResume(ProviderCallException.class, e -> {
                        budget.recordFailure(e);
                        if (e.getCause() instanceof CallNotPermittedException) {
                            // rejected locally, nothing was sent
                            budget.refund();
                            log.debug("Circuit breaker open for {}, skipping", provider.getName());
                            return Mono.error(e);
                        }
                        statsTracker.recordError(provider, e);
                        logCall(provider, fingerprint, elapsedMs(start), null, e);
                        if (e.getCategory() == ErrorCategory.PARSE && allowParseRetry && budget.hasRemaining()) {
                            log.warn("Unparseable response from {}, retrying once: {}", provider.getName(), e.getMessage());
                            return attempt(provider, fingerprint, prompt, budget, false);
                        }
                        return Mono.error(e);
                    });
        });
    }

    private void logCall(Provider provider, String fingerprint, long elapsedMs, Completion completion,
                         ProviderCallException error) {
        requestLog.record(RequestLogEntry.builder()
                .providerId(provider.getId())
                .providerName(provider.getName())
                .requestType(RequestType.CONTENT_ANALYSIS)
                .success(error == null)
                .responseTimeMs(elapsedMs)
                .tokenCount(completion != null ? completion.getTotalTokens() : null)
                .cacheKey(fingerprint)
                .errorType(error != null ? error.getCategory().getCode() : null)
                .errorMessage(error != null ? error.getMessage() : null)
                .build());
    }

    private AnalysisResult toResult(Provider provider, String raw, AttemptBudget budget) {
        ParseOutcome outcome = parser.parse(raw);
        if (!outcome.isSuccess()) {
            throw new ProviderCallException(ErrorCategory.PARSE, provider.getId(), provider.getName(),
                    outcome.getFailureReason());
        }
        AnalysisVerdict verdict = outcome.getVerdict();
        return AnalysisResult.builder()
                .shouldPush(verdict.isShouldPush())
                .confidence(verdict.getConfidence())
                .reason(verdict.getReason())
                .summary(verdict.getSummary())
                .detailedAnalysis(verdict.getDetailedAnalysis())
                .impactAreas(verdict.getImpactAreas())
                .techAreas(verdict.getTechAreas())
                .newsCategories(verdict.getNewsCategories())
                .providerId(provider.getId())
                .providerName(provider.getName())
                .model(provider.getModel())
                .cached(false)
                .attempts(budget.used())
                .latencyMs(budget.elapsedMs())
                .build();
    }

    private Mono<AnalysisResult> remember(String fingerprint, AnalysisResult result) {
        if (!properties.getCache().isEnabled()) {
            return Mono.just(result);
        }
        return cache.store(fingerprint, result, properties.getCache().getTtl())
                .onErrorResume(e -> {
                    log.error("Failed to cache result for {}", fingerprint, e);
                    return Mono.empty();
                })
                .thenReturn(result);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static BatchItemResult failedItem(int index, Throwable error) {
        String type;
        if (error instanceof LlmRoutingException) {
            type = ((LlmRoutingException) error).getCategory().getCode();
        } else if (error instanceof IllegalArgumentException) {
            type = "invalid_request";
        } else {
            type = "internal_error";
        }
        return BatchItemResult.builder()
                .index(index)
                .errorType(type)
                .errorMessage(error.getMessage())
                .build();
    }
}
