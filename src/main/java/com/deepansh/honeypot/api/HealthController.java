package com.deepansh.honeypot.api;

import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.observability.HoneypotMetrics;
import com.deepansh.honeypot.session.ActiveSessionStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * GET /health   liveness, no auth
 * GET /ping     keep-alive, no auth
 * GET /metrics  counters, requires x-api-key
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HoneypotMetrics metrics;
    private final ActiveSessionStore activeStore;
    private final ScamIntelligenceStore scamStore;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "service", "honeypot-session-ledger"));
    }

    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "pong", "timestamp", Instant.now().toString()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(metrics.snapshot(activeStore.countActive(), scamStore.countPending()));
    }
}
