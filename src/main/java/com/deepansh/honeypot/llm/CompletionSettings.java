package com.deepansh.honeypot.llm;

/**
 * Per-call sampling overrides. A null field falls back to the provider's
 * configured value.
 */
public record CompletionSettings(Integer maxTokens, Double temperature, Double topP) {

    public static CompletionSettings defaults() {
        return new CompletionSettings(null, null, null);
    }
}
