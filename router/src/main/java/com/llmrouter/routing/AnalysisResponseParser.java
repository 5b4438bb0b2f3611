package com.llmrouter.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw model output into an {@link AnalysisVerdict}. Models often wrap the JSON in
 * markdown fences or prose, so the first {@code {...}} block is taken.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisResponseParser {

    private static final Pattern FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public ParseOutcome parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseOutcome.failure("Empty response");
        }

        String json = extractJsonObject(raw);
        if (json == null) {
            return ParseOutcome.failure("No JSON object in response");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            return ParseOutcome.failure("Malformed JSON: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            return ParseOutcome.failure("Response is not a JSON object");
        }

        Boolean shouldPush = readBoolean(node.get("should_push"));
        if (shouldPush == null) {
            shouldPush = readBoolean(node.get("is_relevant"));
        }
        if (shouldPush == null) {
            return ParseOutcome.failure("Missing required field 'should_push'");
        }

        String summary = firstNonBlank(text(node, "summary"), text(node, "analytical_briefing"),
                text(node, "detailed_analysis"));
        if (summary == null) {
            return ParseOutcome.failure("Missing required field 'summary'");
        }

        return ParseOutcome.success(AnalysisVerdict.builder()
                .shouldPush(shouldPush)
                .confidence(readConfidence(node.get("confidence")))
                .reason(text(node, "reason"))
                .summary(summary)
                .detailedAnalysis(text(node, "detailed_analysis"))
                .impactAreas(stringList(node.get("impact_areas")))
                .techAreas(stringList(node.get("tech_areas")))
                .newsCategories(stringList(node.get("news_categories")))
                .build());
    }

    static String extractJsonObject(String raw) {
        String stripped = FENCE.matcher(raw).replaceAll("");
        int start = stripped.indexOf('{');
        int end = stripped.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return stripped.substring(start, end + 1);
    }

    private static Boolean readBoolean(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            String text = value.textValue().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("yes")) {
                return true;
            }
            if (text.equals("false") || text.equals("no")) {
                return false;
            }
        }
        return null;
    }

    private static Integer readConfidence(JsonNode value) {
        if (value == null || !value.isNumber()) {
            return null;
        }
        return Math.max(0, Math.min(100, value.intValue()));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            return null;
        }
        return value.textValue().trim();
    }

    private static List<String> stringList(JsonNode value) {
        if (value == null || !value.isArray()) {
            return null;
        }
        List<String> items = new ArrayList<>();
        value.forEach(item -> {
            if (item.isTextual() && !item.textValue().isBlank()) {
                items.add(item.textValue().trim());
            }
        });
        return items;
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }
}
