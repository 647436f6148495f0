package com.deepansh.honeypot.intel;

import com.deepansh.honeypot.model.ReportPayload;
import com.deepansh.honeypot.session.StoreLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Confirmed-scam snapshots and their delivery state.
 *
 * Delivery is best-effort: a record stays pending until a push succeeds,
 * and {@link #listPending()} is what the retry endpoint works through.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScamIntelligenceStore {

    private final ScamIntelligenceRepository intelRepo;
    private final StoreLock storeLock;
    private final Clock clock;

    /** Replaces any existing record for the same session, including its pushed state. */
    public ScamIntelligenceRecord upsert(ScamIntelligenceRecord record) {
        return storeLock.call("scamIntel.upsert", record.getSessionId(), () -> {
            ScamIntelligenceRecord saved = intelRepo.save(record);
            log.info("Scam intelligence saved [sessionId={}, messages={}, items={}]",
                    saved.getSessionId(), saved.getTotalMessagesExchanged(), saved.getEvidence().size());
            return saved;
        });
    }

    public Optional<ScamIntelligenceRecord> find(String sessionId) {
        return storeLock.call("scamIntel.find", sessionId, () -> intelRepo.findById(sessionId));
    }

    public Optional<ReportPayload> getPayload(String sessionId) {
        return find(sessionId).map(ScamIntelligenceRecord::toPayload);
    }

    /**
     * Idempotent. pushedAt records the first successful delivery and is
     * not moved by later calls.
     */
    public void markPushed(String sessionId) {
        storeLock.run("scamIntel.markPushed", sessionId, () -> {
            Optional<ScamIntelligenceRecord> existing = intelRepo.findById(sessionId);
            if (existing.isEmpty()) {
                log.warn("markPushed for unknown scam session [sessionId={}]", sessionId);
                return;
            }
            ScamIntelligenceRecord record = existing.get();
            if (record.isPushedToExternal()) {
                return;
            }
            record.setPushedToExternal(true);
            record.setPushedAt(clock.instant());
            intelRepo.save(record);
            log.info("Marked as pushed [sessionId={}]", sessionId);
        });
    }

    /** Oldest first. */
    public List<String> listPending() {
        return storeLock.call("scamIntel.listPending", null, () ->
                intelRepo.findByPushedToExternalFalseOrderByCreatedAtAsc().stream()
                        .map(ScamIntelligenceRecord::getSessionId)
                        .toList());
    }

    public long countPending() {
        return storeLock.call("scamIntel.countPending", null, intelRepo::countByPushedToExternalFalse);
    }

    public long count() {
        return storeLock.call("scamIntel.count", null, intelRepo::count);
    }

    /** Newest first by creation time, pushed or not. */
    public List<ScamIntelligenceRecord> listRecent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return storeLock.call("scamIntel.listRecent", null, () ->
                intelRepo.findAll(PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "createdAt")))
                        .getContent());
    }

    public long clearAll() {
        return storeLock.call("scamIntel.clearAll", null, () -> {
            long count = intelRepo.count();
            intelRepo.deleteAll();
            log.info("Scam intelligence cleared [count={}]", count);
            return count;
        });
    }
}
