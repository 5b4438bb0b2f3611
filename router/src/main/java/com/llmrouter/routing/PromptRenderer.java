package com.llmrouter.routing;

public final class PromptRenderer {

    static final String PLACEHOLDER = "{content}";

    private PromptRenderer() {
    }

    /**
     * Fills {@code {content}} in the template. A template without the placeholder gets the
     * content appended after a blank line.
     */
    public static String render(String template, String content) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Prompt template cannot be blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content cannot be blank");
        }
        if (template.contains(PLACEHOLDER)) {
            return template.replace(PLACEHOLDER, content);
        }
        return template + "\n\n" + content;
    }
}
