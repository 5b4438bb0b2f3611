package com.llmrouter.controller;

import com.llmrouter.model.AnalysisModels.AnalysisRequest;
import com.llmrouter.model.AnalysisModels.AnalysisResult;
import com.llmrouter.model.AnalysisModels.BatchItemResult;
import com.llmrouter.model.AnalysisModels.BatchRequest;
import com.llmrouter.routing.Dispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class AnalysisController {

    private final Dispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    /**
     * Analyze one piece of content with failover across providers.
     */
    @PostMapping("/analyze")
    public Mono<ResponseEntity<AnalysisResult>> analyze(@Valid @RequestBody AnalysisRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);

        log.info("Analysis request received: media_type={}, content_length={}",
                request.getMediaType(), request.getContent().length());

        return dispatcher.analyze(request)
                .doOnNext(result -> sample.stop(meterRegistry.timer("llm.request.latency",
                        "operation", "analyze", "cached", String.valueOf(result.isCached()))))
                .doOnError(e -> meterRegistry.counter("llm.request.error", "operation", "analyze").increment())
                .map(ResponseEntity::ok);
    }

    /**
     * Analyze several items. Each item fails or succeeds on its own; results keep request order.
     */
    @PostMapping("/analyze/batch")
    public Mono<ResponseEntity<Map<String, Object>>> analyzeBatch(@Valid @RequestBody BatchRequest request) {
        log.info("Batch analysis request received: items={}", request.getItems().size());

        return dispatcher.analyzeBatch(request.getItems())
                .collectList()
                .map(items -> {
                    long succeeded = items.stream().filter(BatchItemResult::isSuccess).count();
                    return ResponseEntity.ok(Map.of(
                            "items", items,
                            "total", items.size(),
                            "succeeded", succeeded,
                            "failed", items.size() - succeeded
                    ));
                });
    }
}
