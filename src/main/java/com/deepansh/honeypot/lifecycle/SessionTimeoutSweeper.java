package com.deepansh.honeypot.lifecycle;

import com.deepansh.honeypot.observability.HoneypotMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically finalizes sessions nobody has written to for the
 * configured timeout. Runs on Spring's scheduler thread and only goes
 * through the engine's public operations.
 *
 * Set honeypot.session.sweeper-enabled=false to turn it off (tests,
 * or a deployment that calls /api/finalize-timeout from cron instead).
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "honeypot.session", name = "sweeper-enabled", havingValue = "true", matchIfMissing = true)
public class SessionTimeoutSweeper {

    private final FinalizationEngine finalizationEngine;
    private final HoneypotMetrics metrics;

    @Scheduled(fixedDelayString = "${honeypot.session.sweep-interval-ms:60000}",
               initialDelayString = "${honeypot.session.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            int finalized = finalizationEngine.finalizeTimedOut();
            metrics.recordFinalized(finalized);
            if (finalized > 0) {
                log.info("Timeout sweep finalized {} session(s)", finalized);
            } else {
                log.debug("Timeout sweep finished [finalized={}]", finalized);
            }
        } catch (Exception e) {
            // next tick runs regardless
            log.error("Timeout sweep failed: {}", e.getMessage(), e);
        }
    }
}
