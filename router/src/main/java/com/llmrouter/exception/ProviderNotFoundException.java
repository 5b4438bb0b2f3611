package com.llmrouter.exception;

public class ProviderNotFoundException extends RuntimeException {

    public ProviderNotFoundException(long id) {
        super("Provider not found: " + id);
    }
}
