package com.llmrouter.routing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Fields a model must (or may) return for one analysis.
 */
@Value
@Builder
public class AnalysisVerdict {
    boolean shouldPush;
    Integer confidence;
    String reason;
    String summary;
    String detailedAnalysis;
    List<String> impactAreas;
    List<String> techAreas;
    List<String> newsCategories;
}
