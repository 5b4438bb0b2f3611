package com.llmrouter.requestlog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One provider call, health probe or cache hit. {@code id} and {@code createdAt} are assigned
 * by the log when the entry is recorded.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestLogEntry {
    long id;

    @JsonProperty("provider_id")
    Long providerId;

    @JsonProperty("provider_name")
    String providerName;

    @JsonProperty("request_type")
    RequestType requestType;

    @JsonProperty("is_success")
    boolean success;

    @JsonProperty("response_time_ms")
    Long responseTimeMs;

    @JsonProperty("token_count")
    Integer tokenCount;

    @JsonProperty("is_cached")
    boolean cached;

    @JsonProperty("cache_key")
    String cacheKey;

    @JsonProperty("error_type")
    String errorType;

    @JsonProperty("error_message")
    String errorMessage;

    @JsonProperty("created_at")
    Instant createdAt;
}
