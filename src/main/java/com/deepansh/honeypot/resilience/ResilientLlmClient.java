package com.deepansh.honeypot.resilience;

import com.deepansh.honeypot.llm.CompletionSettings;
import com.deepansh.honeypot.llm.LlmClient;
import com.deepansh.honeypot.model.LlmResponse;
import com.deepansh.honeypot.model.PromptMessage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the active provider client that adds retry + circuit breaker.
 * {@code @Primary} so the intelligence generator gets this bean, not the raw client.
 *
 * Fallbacks return empty content rather than canned prose: the generator
 * picks the persona-appropriate filler, and an empty extraction response
 * parses to empty evidence.
 *
 * Retry config (application.yml):
 * - 3 attempts, exponential backoff 1s → 2s
 * - LlmClientException is ignored (bad key / bad request will not improve)
 *
 * Circuit breaker config:
 * - Opens after 50% failures in a sliding window of 10 calls
 * - 30s before half-open trial calls
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements LlmClient {

    private final LlmClient delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") LlmClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = "llmClient", fallbackMethod = "retryFallback")
    @CircuitBreaker(name = "llmClient", fallbackMethod = "circuitBreakerFallback")
    public LlmResponse chat(List<PromptMessage> messages, CompletionSettings settings) {
        return delegate.chat(messages, settings);
    }

    public LlmResponse retryFallback(List<PromptMessage> messages,
                                     CompletionSettings settings,
                                     Exception ex) {
        log.error("LLM call failed after all retries: {}", ex.getMessage());
        return LlmResponse.empty();
    }

    public LlmResponse circuitBreakerFallback(List<PromptMessage> messages,
                                              CompletionSettings settings,
                                              Exception ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        return LlmResponse.empty();
    }
}
