package com.deepansh.honeypot.report;

import com.deepansh.honeypot.config.HoneypotProperties;
import com.deepansh.honeypot.exception.ReporterException;
import com.deepansh.honeypot.model.ReportPayload;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;

/**
 * POSTs scam snapshots to the evaluator endpoint as JSON.
 *
 * | Outcome            | Result                                    |
 * |--------------------|-------------------------------------------|
 * | 2xx                | true                                      |
 * | 4xx / 5xx          | ReporterException, counted by the breaker |
 * | timeout / IO error | ReporterException, counted by the breaker |
 * | breaker open       | fallback, false                           |
 *
 * Callers treat false and an exception the same way: the record stays
 * pending and can be retried through the push-pending endpoint.
 */
@Component
@Slf4j
public class HttpReporterGateway implements ReporterGateway {

    private final HoneypotProperties.Reporter config;
    private final RestClient restClient;

    public HttpReporterGateway(HoneypotProperties properties,
                               @Qualifier("reporterRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.config = properties.getReporter();
        this.restClient = restClientBuilder
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    @CircuitBreaker(name = "reporter", fallbackMethod = "pushFallback")
    public boolean push(ReportPayload payload) {
        if (!isEnabled()) {
            log.info("Reporter disabled, skipping push [sessionId={}]", payload.sessionId());
            return false;
        }

        log.info("Pushing scam intelligence [sessionId={}, url={}]", payload.sessionId(), config.getUrl());
        try {
            ResponseEntity<Void> response = restClient.post()
                    .uri(config.getUrl())
                    .body(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("Reporter rejected push [sessionId={}, status={}]: {}",
                                payload.sessionId(), res.getStatusCode(), body);
                        throw new ReporterException(
                                "Evaluator returned " + res.getStatusCode().value() + " for " + payload.sessionId());
                    })
                    .toBodilessEntity();

            log.info("Push acknowledged [sessionId={}, status={}]", payload.sessionId(), response.getStatusCode());
            return true;

        } catch (ResourceAccessException e) {
            log.error("Reporter unreachable [sessionId={}]: {}", payload.sessionId(), e.getMessage());
            throw new ReporterException("Evaluator unreachable for " + payload.sessionId(), e);
        }
    }

    /** Breaker open, or the push failed and the breaker recorded it. */
    public boolean pushFallback(ReportPayload payload, Throwable ex) {
        log.warn("Reporter push failed, record stays pending [sessionId={}]: {}",
                payload.sessionId(), ex.getMessage());
        return false;
    }
}
