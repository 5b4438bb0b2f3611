package com.llmrouter.exception;

import lombok.Getter;

/**
 * Every candidate failed, or the attempt budget / request deadline ran out first.
 * The last concrete provider failure is kept as the cause.
 */
@Getter
public class ProvidersExhaustedException extends LlmRoutingException {

    private final int attempts;

    public ProvidersExhaustedException(String reason, int attempts, ProviderCallException lastError) {
        super(ErrorCategory.ALL_PROVIDERS_EXHAUSTED, buildMessage(reason, attempts, lastError), lastError);
        this.attempts = attempts;
    }

    public ProviderCallException getLastError() {
        return (ProviderCallException) getCause();
    }

    private static String buildMessage(String reason, int attempts, ProviderCallException lastError) {
        StringBuilder sb = new StringBuilder("All providers exhausted (")
                .append(reason).append(", ").append(attempts).append(" attempt(s))");
        if (lastError != null) {
            sb.append("; last error from ").append(lastError.getProviderName())
                    .append(" [").append(lastError.getCategory().getCode()).append("]: ")
                    .append(lastError.getMessage());
        }
        return sb.toString();
    }
}
