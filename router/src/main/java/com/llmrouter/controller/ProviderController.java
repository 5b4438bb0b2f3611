package com.llmrouter.controller;

import com.llmrouter.exception.ProviderNotFoundException;
import com.llmrouter.model.ProviderModels.ProviderRequest;
import com.llmrouter.model.ProviderModels.ProviderView;
import com.llmrouter.provider.LlmClient;
import com.llmrouter.registry.Provider;
import com.llmrouter.registry.ProviderDefinition;
import com.llmrouter.registry.ProviderRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Provider administration. API keys are accepted on write and never echoed back.
 */
@Slf4j
@RestController
@RequestMapping("/admin/providers")
@RequiredArgsConstructor
public class ProviderController {

    private final ProviderRegistry registry;
    private final LlmClient client;

    @GetMapping
    public ResponseEntity<List<ProviderView>> list(@RequestParam(name = "active_only", defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(registry.list(activeOnly).stream()
                .map(this::toView)
                .collect(Collectors.toList()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ProviderView> get(@PathVariable long id) {
        return registry.get(id)
                .map(this::toView)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ProviderNotFoundException(id));
    }

    @PostMapping
    public ResponseEntity<ProviderView> create(@Valid @RequestBody ProviderRequest request) {
        Provider created = registry.create(ProviderDefinition.builder()
                .name(request.getName())
                .apiBase(request.getApiBase())
                .apiKey(request.getApiKey())
                .model(request.getModel())
                .priority(valueOr(request.getPriority(), 10))
                .active(valueOr(request.getActive(), true))
                .supportsText(valueOr(request.getSupportsText(), true))
                .supportsImage(valueOr(request.getSupportsImage(), false))
                .supportsVideo(valueOr(request.getSupportsVideo(), false))
                .supportsGif(valueOr(request.getSupportsGif(), false))
                .build());
        log.info("Provider created: id={}, name={}", created.getId(), created.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(created));
    }

    /**
     * Replaces the provider's attributes. Omitted flags and a blank API key keep their stored values.
     */
    @PutMapping("/{id}")
    public ResponseEntity<ProviderView> update(@PathVariable long id, @Valid @RequestBody ProviderRequest request) {
        Provider updated = registry.update(id, current -> current.toBuilder()
                .name(request.getName())
                .apiBase(request.getApiBase())
                .apiKey(request.getApiKey() == null || request.getApiKey().isBlank()
                        ? current.getApiKey() : request.getApiKey())
                .model(request.getModel())
                .priority(valueOr(request.getPriority(), current.getPriority()))
                .active(valueOr(request.getActive(), current.isActive()))
                .supportsText(valueOr(request.getSupportsText(), current.isSupportsText()))
                .supportsImage(valueOr(request.getSupportsImage(), current.isSupportsImage()))
                .supportsVideo(valueOr(request.getSupportsVideo(), current.isSupportsVideo()))
                .supportsGif(valueOr(request.getSupportsGif(), current.isSupportsGif()))
                .build());
        log.info("Provider updated: id={}, name={}", updated.getId(), updated.getName());
        return ResponseEntity.ok(toView(updated));
    }

    @PutMapping("/{id}/active")
    public ResponseEntity<ProviderView> setActive(@PathVariable long id, @RequestParam boolean enabled) {
        Provider provider = registry.setActive(id, enabled);
        log.info("Provider {} {}", provider.getName(), enabled ? "activated" : "deactivated");
        return ResponseEntity.ok(toView(provider));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable long id) {
        if (!registry.delete(id)) {
            throw new ProviderNotFoundException(id);
        }
        client.release(id);
        log.info("Provider deleted: id={}", id);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "id", id
        ));
    }

    private ProviderView toView(Provider provider) {
        return ProviderView.builder()
                .id(provider.getId())
                .name(provider.getName())
                .apiBase(provider.getApiBase())
                .model(provider.getModel())
                .priority(provider.getPriority())
                .active(provider.isActive())
                .supportsText(provider.isSupportsText())
                .supportsImage(provider.isSupportsImage())
                .supportsVideo(provider.isSupportsVideo())
                .supportsGif(provider.isSupportsGif())
                .apiKeyConfigured(provider.getApiKey() != null && !provider.getApiKey().isBlank())
                .healthStatus(provider.getHealthStatus())
                .lastCheckedAt(provider.getLastCheckedAt())
                .healthCheckCount(provider.getHealthCheckCount())
                .healthFailureCount(provider.getHealthFailureCount())
                .lastHealthCheck(registry.lastHealthCheck(provider.getId()).orElse(null))
                .stats(registry.usage(provider.getId()).orElse(null))
                .build();
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
