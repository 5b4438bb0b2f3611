package com.llmrouter.exception;

import lombok.Getter;

@Getter
public class LlmRoutingException extends RuntimeException {

    private final ErrorCategory category;

    public LlmRoutingException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    public LlmRoutingException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }
}
