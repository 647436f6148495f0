package com.deepansh.honeypot.report;

import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.model.ReportPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Retries delivery of every scam record that has not been acknowledged yet.
 * Each push runs outside the store lock; only the read of the pending list
 * and each markPushed take it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReportingService {

    private final ScamIntelligenceStore scamStore;
    private final ReporterGateway reporterGateway;

    public PushSummary pushAllPending() {
        if (!reporterGateway.isEnabled()) {
            log.info("Reporter disabled, push-all-pending skipped");
            return PushSummary.disabled();
        }

        List<String> pending = scamStore.listPending();
        int success = 0;
        int failed = 0;

        for (String sessionId : pending) {
            if (pushOne(sessionId)) {
                success++;
            } else {
                failed++;
            }
        }

        log.info("Push-all-pending finished [pending={}, success={}, failed={}]",
                pending.size(), success, failed);
        return new PushSummary(true, pending.size(), success, failed);
    }

    /** Push a single stored record; false if it is missing or delivery failed. */
    public boolean pushOne(String sessionId) {
        Optional<ReportPayload> payload = scamStore.getPayload(sessionId);
        if (payload.isEmpty()) {
            log.warn("No scam intelligence to push [sessionId={}]", sessionId);
            return false;
        }

        boolean delivered;
        try {
            delivered = reporterGateway.push(payload.get());
        } catch (RuntimeException e) {
            log.error("Push failed [sessionId={}]: {}", sessionId, e.getMessage());
            return false;
        }

        if (delivered) {
            scamStore.markPushed(sessionId);
        }
        return delivered;
    }
}
