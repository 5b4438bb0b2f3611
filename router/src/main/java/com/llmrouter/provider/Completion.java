package com.llmrouter.provider;

import lombok.Value;

/**
 * Model output of one completion call. {@code totalTokens} is null when the backend
 * reports no usage block.
 */
@Value
public class Completion {
    String content;
    Integer totalTokens;

    public static Completion of(String content) {
        return new Completion(content, null);
    }
}
