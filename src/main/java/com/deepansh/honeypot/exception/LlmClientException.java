package com.deepansh.honeypot.exception;

/**
 * Non-retryable LLM failure (bad key, bad model, malformed response).
 * Listed in the resilience4j ignore-exceptions so it neither retries
 * nor trips the circuit breaker.
 */
public class LlmClientException extends HoneypotException {

    public LlmClientException(String message) {
        super(message);
    }

    public LlmClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
