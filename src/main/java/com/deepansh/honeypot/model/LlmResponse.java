package com.deepansh.honeypot.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LlmResponse {

    /** Completion text; empty when the call degraded to a fallback */
    private String content;

    @Builder.Default
    private int promptTokens = 0;

    @Builder.Default
    private int completionTokens = 0;

    public static LlmResponse empty() {
        return LlmResponse.builder().content("").build();
    }
}
