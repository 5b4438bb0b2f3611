package com.llmrouter.requestlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RequestType {
    CONTENT_ANALYSIS("content_analysis"),
    HEALTH_CHECK("health_check");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RequestType fromValue(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RequestType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported request type: " + value);
    }
}
