package com.deepansh.honeypot.lifecycle;

import com.deepansh.honeypot.archive.ArchiveStore;
import com.deepansh.honeypot.archive.ArchivedSession;
import com.deepansh.honeypot.config.HoneypotProperties;
import com.deepansh.honeypot.exception.SessionNotFoundException;
import com.deepansh.honeypot.exception.StorageException;
import com.deepansh.honeypot.intel.ScamIntelligenceRecord;
import com.deepansh.honeypot.intel.ScamIntelligenceStore;
import com.deepansh.honeypot.session.ActiveSessionStore;
import com.deepansh.honeypot.session.FullSession;
import com.deepansh.honeypot.session.StoreLock;
import com.deepansh.honeypot.report.ReporterGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Moves a session out of the active store.
 *
 * Order inside the store lock:
 *   1. read the full session (absent → SessionNotFoundException, nothing touched)
 *   2. confirmed scam → upsert the scam-intelligence snapshot
 *   3. upsert the archive snapshot (every session)
 *   4. clear the active session
 *
 * The evaluator push happens after the lock is released. A failed push
 * leaves the record pending; it never fails the finalization.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FinalizationEngine {

    private final ActiveSessionStore activeStore;
    private final ArchiveStore archiveStore;
    private final ScamIntelligenceStore scamStore;
    private final ReporterGateway reporterGateway;
    private final StoreLock storeLock;
    private final HoneypotProperties properties;
    private final Clock clock;

    public FinalizationResult finalizeSession(String sessionId, boolean pushExternal) {
        Moved moved = storeLock.call("finalize", sessionId, () -> moveToArchive(sessionId, null));
        return afterMove(moved, pushExternal);
    }

    /**
     * Finalizes every session idle for longer than the configured timeout.
     * Timed-out sessions are never pushed; they wait for push-pending.
     *
     * @return number of sessions actually finalized
     */
    public int finalizeTimedOut() {
        Duration timeout = Duration.ofSeconds(properties.getSession().getTimeoutSeconds());
        Instant cutoff = clock.instant().minus(timeout);
        List<String> idle = activeStore.findIdleSince(cutoff);

        int finalized = 0;
        for (String sessionId : idle) {
            try {
                Moved moved = storeLock.call("finalizeTimedOut", sessionId,
                        () -> moveToArchive(sessionId, cutoff));
                afterMove(moved, false);
                finalized++;
                log.info("Session timed out and finalized [sessionId={}]", sessionId);
            } catch (SessionNotFoundException e) {
                log.debug("Session gone before timeout finalization [sessionId={}]", sessionId);
            } catch (SessionStillActiveException e) {
                log.debug("Session received a message since the sweep started [sessionId={}]", sessionId);
            } catch (StorageException e) {
                log.error("Timeout finalization failed, continuing sweep [sessionId={}]: {}",
                        sessionId, e.getMessage());
            } catch (RuntimeException e) {
                // one broken session must not stall every session queued behind it
                log.error("Unexpected error finalizing timed-out session, continuing sweep [sessionId={}]",
                        sessionId, e);
            }
        }
        return finalized;
    }

    /**
     * Must run under the store lock. {@code idleCutoff} is non-null for the
     * sweeper, which re-checks idleness here because a turn may have
     * arrived between the idle query and taking the lock.
     *
     * @return what was written; the scam snapshot is null for a benign session
     */
    private Moved moveToArchive(String sessionId, Instant idleCutoff) {
        FullSession full = activeStore.getFullSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        if (idleCutoff != null && !full.session().getUpdatedAt().isBefore(idleCutoff)) {
            throw new SessionStillActiveException(sessionId);
        }

        Instant now = clock.instant();
        ScamIntelligenceRecord scamRecord = null;
        if (full.session().isConfirmedScam()) {
            scamRecord = scamStore.upsert(ScamIntelligenceRecord.snapshotOf(full, now));
        }
        ArchivedSession archived = archiveStore.upsert(ArchivedSession.snapshotOf(full, now));
        activeStore.clear(sessionId);
        return new Moved(archived, scamRecord);
    }

    private FinalizationResult afterMove(Moved moved, boolean pushExternal) {
        ArchivedSession archived = moved.archived();
        boolean scam = moved.scamRecord() != null;
        boolean pushed = scam && pushExternal && push(moved.scamRecord());

        FinalizationResult result = new FinalizationResult(
                archived.getSessionId(),
                scam,
                archived.getScamFlagsCount(),
                archived.getTotalMessages(),
                pushed);
        log.info("Session finalized [sessionId={}, scam={}, messages={}, pushed={}]",
                result.sessionId(), scam, result.totalMessages(), pushed);
        return result;
    }

    private boolean push(ScamIntelligenceRecord scamRecord) {
        if (!reporterGateway.isEnabled()) {
            return false;
        }
        String sessionId = scamRecord.getSessionId();
        boolean delivered;
        try {
            delivered = reporterGateway.push(scamRecord.toPayload());
        } catch (RuntimeException e) {
            log.error("Reporter push failed, record stays pending [sessionId={}]: {}", sessionId, e.getMessage());
            return false;
        }
        if (delivered) {
            scamStore.markPushed(sessionId);
        }
        return delivered;
    }

    private record Moved(ArchivedSession archived, ScamIntelligenceRecord scamRecord) {
    }

    /** A sweep candidate turned out not to be idle once the lock was held. */
    static class SessionStillActiveException extends RuntimeException {
        SessionStillActiveException(String sessionId) {
            super("Session " + sessionId + " is no longer idle");
        }
    }
}
