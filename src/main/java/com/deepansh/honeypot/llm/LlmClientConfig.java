package com.deepansh.honeypot.llm;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client based on the LLM_PROVIDER env var.
 * Wrapped by ResilientLlmClient for retry + circuit breaker.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:nvidia}")
    private String provider;

    // NVIDIA NIM
    @Value("${nvidia.api-key:}") private String nvidiaKey;
    @Value("${nvidia.base-url}") private String nvidiaBaseUrl;
    @Value("${nvidia.model}")    private String nvidiaModel;
    @Value("${nvidia.max-tokens}") private int nvidiaMaxTokens;
    @Value("${nvidia.temperature}") private double nvidiaTemp;
    @Value("${nvidia.system-role-supported:false}") private boolean nvidiaSystemRole;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url}") private String openAiBaseUrl;
    @Value("${openai.model}")    private String openAiModel;
    @Value("${openai.max-tokens}") private int openAiMaxTokens;
    @Value("${openai.temperature}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url}") private String groqBaseUrl;
    @Value("${groq.model}")    private String groqModel;
    @Value("${groq.max-tokens}") private int groqMaxTokens;
    @Value("${groq.temperature}") private double groqTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Active LLM Provider : {}", provider.toUpperCase());
        log.info("  Model               : {}", activeModel());
        log.info("================================================================");
    }

    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(@Qualifier("llmRestClientBuilder") RestClient.Builder builder) {
        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(
                        props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp, true),
                        "openai", builder.clone());
            }
            case "groq" -> {
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(
                        props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp, true),
                        "groq", builder.clone());
            }
            default -> { // nvidia
                logKey("NVIDIA", nvidiaKey, "NVIDIA_API_KEY");
                yield new GenericLlmClient(
                        props(nvidiaKey, nvidiaBaseUrl, nvidiaModel, nvidiaMaxTokens, nvidiaTemp, nvidiaSystemRole),
                        "nvidia", builder.clone());
            }
        };
    }

    private LlmProviderProperties props(String key, String baseUrl, String model,
                                        int maxTokens, double temperature, boolean systemRole) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key); p.setBaseUrl(baseUrl); p.setModel(model);
        p.setMaxTokens(maxTokens); p.setTemperature(temperature);
        p.setSystemRoleSupported(systemRole);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "groq" -> groqModel;
            default -> nvidiaModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("  {} API key not set! Set env var: {}={your-key}", name, envVar);
            log.error("  Replies will fall back to canned text until a key is configured");
        } else {
            log.info("  Key: {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
