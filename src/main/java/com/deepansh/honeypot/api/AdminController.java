package com.deepansh.honeypot.api;

import com.deepansh.honeypot.archive.ArchiveStore;
import com.deepansh.honeypot.archive.ArchivedSession;
import com.deepansh.honeypot.exception.SessionNotFoundException;
import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.lifecycle.FinalizationEngine;
import com.deepansh.honeypot.lifecycle.FinalizationResult;
import com.deepansh.honeypot.model.EndSessionRequest;
import com.deepansh.honeypot.observability.HoneypotMetrics;
import com.deepansh.honeypot.report.PushSummary;
import com.deepansh.honeypot.report.ReportingService;
import com.deepansh.honeypot.session.ActiveSessionStore;
import com.deepansh.honeypot.session.FullSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Session lifecycle and reporting operations.
 *
 * POST /api/end-session            finalize one session and push if it was a scam
 * POST /api/finalize-timeout       run the timeout sweep now
 * GET  /api/session-status/{id}    live view of an active session
 * POST /api/push-pending           retry every unacknowledged scam report
 * GET  /api/archive                finished sessions, newest first
 * GET  /api/archive/{id}           one finished session
 * GET  /api/scam-intel/pending     ids still waiting for a successful push
 * POST /api/clear-active           drop every active session without archiving
 * GET  /api/view-db/{store}        newest rows of current, archive, scams or all
 * POST /api/clear-all-data         wipe all three stores and reset the counters
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private static final int MAX_PAGE = 200;
    private static final int VIEW_LIMIT = 50;
    private static final Set<String> VIEWABLE = Set.of("current", "archive", "scams", "all");

    private final FinalizationEngine finalizationEngine;
    private final ActiveSessionStore activeStore;
    private final ArchiveStore archiveStore;
    private final ScamIntelligenceStore scamStore;
    private final ReportingService reportingService;
    private final HoneypotMetrics metrics;

    @PostMapping("/end-session")
    public ResponseEntity<Map<String, Object>> endSession(@Valid @RequestBody EndSessionRequest request) {
        FinalizationResult result = finalizationEngine.finalizeSession(request.getSessionId(), true);
        metrics.recordFinalized(1);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("message", "Session " + result.sessionId() + " finalized");
        body.put("wasScam", result.scam());
        body.put("scamFlags", result.scamFlags());
        body.put("totalMessages", result.totalMessages());
        body.put("pushed", result.pushed());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/finalize-timeout")
    public ResponseEntity<Map<String, Object>> finalizeTimeout() {
        int count = finalizationEngine.finalizeTimedOut();
        metrics.recordFinalized(count);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "finalizedCount", count,
                "message", "Finalized " + count + " timed-out session(s)"));
    }

    @GetMapping("/session-status/{sessionId}")
    public ResponseEntity<Map<String, Object>> sessionStatus(@PathVariable String sessionId) {
        FullSession full = activeStore.getFullSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("sessionId", sessionId);
        body.put("scamFlags", full.session().getScamFlags());
        body.put("confirmedScam", full.session().isConfirmedScam());
        body.put("messageCount", full.totalMessages());
        body.put("extractedIntelligence", full.evidence());
        body.put("agentNotes", full.agentNotes() != null ? full.agentNotes() : "");
        return ResponseEntity.ok(body);
    }

    @PostMapping("/push-pending")
    public ResponseEntity<Map<String, Object>> pushPending() {
        PushSummary summary = reportingService.pushAllPending();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("enabled", summary.enabled());
        body.put("totalPending", summary.totalPending());
        body.put("success", summary.success());
        body.put("failed", summary.failed());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/archive")
    public ResponseEntity<Map<String, Object>> archive(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        int boundedLimit = Math.min(Math.max(limit, 0), MAX_PAGE);
        int boundedOffset = Math.max(offset, 0);
        List<ArchivedSession> sessions = archiveStore.list(boundedLimit, boundedOffset);

        return ResponseEntity.ok(Map.of(
                "total", archiveStore.count(),
                "limit", boundedLimit,
                "offset", boundedOffset,
                "sessions", sessions));
    }

    @GetMapping("/archive/{sessionId}")
    public ResponseEntity<ArchivedSession> archivedSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(archiveStore.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId)));
    }

    @GetMapping("/scam-intel/pending")
    public ResponseEntity<Map<String, Object>> pendingScamIntel() {
        List<String> pending = scamStore.listPending();
        return ResponseEntity.ok(Map.of("count", pending.size(), "sessionIds", pending));
    }

    @PostMapping("/clear-active")
    public ResponseEntity<Map<String, Object>> clearActive() {
        long cleared = activeStore.clearAll();
        log.warn("All active sessions cleared via admin endpoint [count={}]", cleared);
        return ResponseEntity.ok(Map.of("status", "success", "cleared", cleared));
    }

    @GetMapping("/view-db/{store}")
    public ResponseEntity<Map<String, Object>> viewDb(@PathVariable String store) {
        if (!VIEWABLE.contains(store)) {
            return ResponseEntity.badRequest().body(Map.of(
                    "status", "error",
                    "message", "Unknown store '" + store + "', expected one of current, archive, scams, all",
                    "timestamp", Instant.now().toString()));
        }
        boolean all = store.equals("all");

        Map<String, Object> body = new LinkedHashMap<>();
        if (all || store.equals("current")) {
            body.put("currentSessions", activeStore.listActive().stream()
                    .limit(VIEW_LIMIT)
                    .map(session -> activeStore.getFullSession(session.getSessionId()))
                    .flatMap(Optional::stream)
                    .toList());
        }
        if (all || store.equals("archive")) {
            body.put("archive", archiveStore.list(VIEW_LIMIT, 0));
        }
        if (all || store.equals("scams")) {
            body.put("scamIntelligence", scamStore.listRecent(VIEW_LIMIT));
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/clear-all-data")
    public ResponseEntity<Map<String, Object>> clearAllData() {
        long active = activeStore.clearAll();
        long archived = archiveStore.clearAll();
        long scams = scamStore.clearAll();
        metrics.reset();
        log.warn("All stored data cleared via admin endpoint [active={}, archived={}, scamIntel={}]",
                active, archived, scams);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("activeCleared", active);
        body.put("archiveCleared", archived);
        body.put("scamIntelCleared", scams);
        return ResponseEntity.ok(body);
    }
}
