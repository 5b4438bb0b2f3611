package com.llmrouter.registry;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Operator-managed attributes of a provider. Replaced as a whole on every edit.
 */
@Value
@Builder(toBuilder = true)
public class ProviderDefinition {
    Long id;
    String name;
    String apiBase;
    @ToString.Exclude
    String apiKey;
    String model;
    int priority;
    @Builder.Default
    boolean active = true;
    @Builder.Default
    boolean supportsText = true;
    boolean supportsImage;
    boolean supportsVideo;
    boolean supportsGif;
    Instant createdAt;
    Instant updatedAt;
}
