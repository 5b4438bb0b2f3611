package com.llmrouter.exception;

import lombok.Getter;

/**
 * One failed call against one provider.
 */
@Getter
public class ProviderCallException extends LlmRoutingException {

    private final Long providerId;
    private final String providerName;

    public ProviderCallException(ErrorCategory category, Long providerId, String providerName,
                                 String message, Throwable cause) {
        super(category, message, cause);
        this.providerId = providerId;
        this.providerName = providerName;
    }

    public ProviderCallException(ErrorCategory category, Long providerId, String providerName, String message) {
        this(category, providerId, providerName, message, null);
    }
}
