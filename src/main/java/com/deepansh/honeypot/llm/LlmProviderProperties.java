package com.deepansh.honeypot.llm;

import lombok.Data;

/**
 * Config for a single LLM provider.
 * Populated from application.yml for nvidia / openai / groq.
 */
@Data
public class LlmProviderProperties {
    private String apiKey;
    private String baseUrl;
    private String model;
    private int maxTokens;
    private double temperature;

    /**
     * Some hosted models reject the system role. When false, system
     * messages are rewritten as an instruction exchange.
     */
    private boolean systemRoleSupported = true;
}
