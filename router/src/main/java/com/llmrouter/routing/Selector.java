package com.llmrouter.routing;

import com.llmrouter.config.LlmRouterProperties;
import com.llmrouter.model.HealthStatus;
import com.llmrouter.model.MediaType;
import com.llmrouter.registry.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders candidate providers for one request: available before unknown, each group by
 * priority, then observed latency, then id. Unavailable providers are only returned when
 * nothing else qualifies.
 */
@Component
@RequiredArgsConstructor
public class Selector {

    static final Comparator<Provider> ORDER = Comparator.comparingInt(Provider::getPriority)
            .thenComparingDouble(Provider::getAvgResponseTimeMs)
            .thenComparingLong(Provider::getId);

    private final LlmRouterProperties properties;

    public List<Provider> select(List<Provider> candidates, MediaType mediaType) {
        return select(candidates, mediaType, properties.getRouting().isUnavailableFallback());
    }

    /**
     * @return ordered candidates; empty when no active provider supports the media type
     */
    public static List<Provider> select(List<Provider> candidates, MediaType mediaType,
                                        boolean unavailableFallback) {
        List<Provider> eligible = candidates.stream()
                .filter(Provider::isActive)
                .filter(p -> p.supports(mediaType))
                .collect(Collectors.toList());

        List<Provider> ordered = new ArrayList<>();
        ordered.addAll(withStatus(eligible, HealthStatus.AVAILABLE));
        ordered.addAll(withStatus(eligible, HealthStatus.UNKNOWN));

        if (ordered.isEmpty() && unavailableFallback) {
            ordered.addAll(withStatus(eligible, HealthStatus.UNAVAILABLE));
        }
        return ordered;
    }

    private static List<Provider> withStatus(List<Provider> providers, HealthStatus status) {
        return providers.stream()
                .filter(p -> p.getHealthStatus() == status)
                .sorted(ORDER)
                .collect(Collectors.toList());
    }
}
