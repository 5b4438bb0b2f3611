package com.llmrouter.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

public class AnalysisModels {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnalysisRequest {
        @NotBlank(message = "Content cannot be blank")
        private String content;

        @JsonProperty("media_type")
        @Builder.Default
        private MediaType mediaType = MediaType.TEXT;

        @NotBlank(message = "Prompt template cannot be blank")
        @JsonProperty("prompt_template")
        private String promptTemplate;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchRequest {
        @NotEmpty(message = "Items cannot be empty")
        @Valid
        private List<AnalysisRequest> items;
    }

    /**
     * Typed outcome of one analysis. Immutable so a cached copy can be handed to
     * concurrent readers.
     */
    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class AnalysisResult {
        @JsonProperty("should_push")
        boolean shouldPush;

        Integer confidence;

        String reason;

        String summary;

        @JsonProperty("detailed_analysis")
        String detailedAnalysis;

        @JsonProperty("impact_areas")
        List<String> impactAreas;

        @JsonProperty("tech_areas")
        List<String> techAreas;

        @JsonProperty("news_categories")
        List<String> newsCategories;

        @JsonProperty("provider_id")
        Long providerId;

        @JsonProperty("provider_name")
        String providerName;

        String model;

        boolean cached;

        int attempts;

        @JsonProperty("latency_ms")
        long latencyMs;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class BatchItemResult {
        int index;
        AnalysisResult result;

        @JsonProperty("error_type")
        String errorType;

        @JsonProperty("error_message")
        String errorMessage;

        public boolean isSuccess() {
            return result != null;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorResponse {
        private Error error;

        @Data
        @Builder
        @NoArgsConstructor
        @AllArgsConstructor
        public static class Error {
            private String message;
            private String type;
            private String code;
        }
    }
}
