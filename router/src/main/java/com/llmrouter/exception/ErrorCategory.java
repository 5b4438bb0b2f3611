package com.llmrouter.exception;

/**
 * Failure categories for provider calls and routing outcomes.
 */
public enum ErrorCategory {

    NETWORK("network", true),
    TIMEOUT("timeout", true),
    AUTH("auth", false),
    RATE_LIMIT("rate_limit", true),
    SERVER("server", true),
    CLIENT("client", false),
    PARSE("parse", false),
    NO_ELIGIBLE_PROVIDER("no_eligible_provider", false),
    ALL_PROVIDERS_EXHAUSTED("all_providers_exhausted", false);

    private final String code;
    private final boolean retryable;

    ErrorCategory(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    /**
     * Transient failures worth sending to the next provider. Non-retryable provider failures
     * still fail over, they are just not expected to clear up on their own.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
