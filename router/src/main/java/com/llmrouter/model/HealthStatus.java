package com.llmrouter.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    UNKNOWN,
    AVAILABLE,
    UNAVAILABLE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
