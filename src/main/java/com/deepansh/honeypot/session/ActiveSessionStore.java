package com.deepansh.honeypot.session;

import com.deepansh.honeypot.config.HoneypotProperties;
import com.deepansh.honeypot.model.Evidence;
import com.deepansh.honeypot.model.ScamStatus;
import com.deepansh.honeypot.model.Sender;
import com.deepansh.honeypot.model.SessionMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * State of every conversation still in progress: the session header,
 * its ordered messages and the evidence merged so far.
 *
 * All operations run under {@link StoreLock}, so a read here never sees
 * half of a finalization.
 *
 * Session creation is implicit. The first appended message opens the
 * session using the caller's metadata (or the configured defaults);
 * metadata on later messages is ignored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ActiveSessionStore {

    private final ActiveSessionRepository sessionRepo;
    private final SessionMessageRepository messageRepo;
    private final ExtractedIntelRepository intelRepo;
    private final StoreLock storeLock;
    private final HoneypotProperties properties;
    private final Clock clock;

    public SessionMessage appendMessage(String sessionId,
                                        Sender sender,
                                        String text,
                                        boolean isResponse,
                                        boolean isScamFlag,
                                        SessionMetadata metadata) {
        return storeLock.call("appendMessage", sessionId, () -> {
            Instant now = clock.instant();
            ActiveSession session = sessionRepo.findById(sessionId)
                    .orElseGet(() -> openSession(sessionId, metadata, now));
            return append(session, sender, text, isResponse, isScamFlag, now);
        });
    }

    /**
     * Appends only if the session is still active, checked under the same
     * lock as the write. Empty when the session was finalized or cleared in
     * the meantime; the session is never reopened from here.
     */
    public Optional<SessionMessage> appendIfActive(String sessionId, Sender sender, String text, boolean isResponse) {
        return storeLock.call("appendIfActive", sessionId, () -> sessionRepo.findById(sessionId)
                .map(session -> append(session, sender, text, isResponse, false, clock.instant())));
    }

    /**
     * Unions {@code newEvidence} into what the session already holds.
     * Notes are replaced only by a non-blank value. Nothing is written
     * when the merge changes nothing, so re-merging the same evidence is
     * a no-op. Merging into a session that is not active is ignored.
     */
    public void mergeIntelligence(String sessionId, Evidence newEvidence, String agentNotes) {
        storeLock.run("mergeIntelligence", sessionId, () -> {
            if (!sessionRepo.existsById(sessionId)) {
                log.warn("Ignoring intelligence for inactive session [sessionId={}]", sessionId);
                return;
            }

            ExtractedIntel current = intelRepo.findById(sessionId)
                    .orElseGet(() -> ExtractedIntel.builder().sessionId(sessionId).build());

            Evidence merged = Evidence.empty().union(current.getEvidence()).union(newEvidence);
            String notes = agentNotes != null && !agentNotes.isBlank()
                    ? agentNotes.trim()
                    : current.getAgentNotes();

            boolean unchanged = current.getUpdatedAt() != null
                    && merged.equals(current.getEvidence())
                    && Objects.equals(notes, current.getAgentNotes());
            if (unchanged) {
                return;
            }

            current.setEvidence(merged);
            current.setAgentNotes(notes);
            current.setUpdatedAt(clock.instant());
            intelRepo.save(current);

            log.debug("Intelligence merged [sessionId={}, items={}]", sessionId, merged.size());
        });
    }

    /** Zero flags, unconfirmed, for a session that is not active. */
    public ScamStatus getScamStatus(String sessionId) {
        return storeLock.call("getScamStatus", sessionId, () -> sessionRepo.findById(sessionId)
                .map(s -> new ScamStatus(s.getScamFlags(), s.isConfirmedScam()))
                .orElse(ScamStatus.none()));
    }

    public Optional<FullSession> getFullSession(String sessionId) {
        return storeLock.call("getFullSession", sessionId, () -> sessionRepo.findById(sessionId)
                .map(session -> {
                    List<SessionMessage> messages = messageRepo.findBySessionIdOrderBySeqAsc(sessionId);
                    Optional<ExtractedIntel> intel = intelRepo.findById(sessionId);
                    Evidence evidence = intel.map(ExtractedIntel::getEvidence)
                            .map(e -> Evidence.empty().union(e))
                            .orElseGet(Evidence::empty);
                    String notes = intel.map(ExtractedIntel::getAgentNotes).orElse(null);
                    return new FullSession(session, List.copyOf(messages), evidence, notes);
                }));
    }

    public boolean isActive(String sessionId) {
        return storeLock.call("isActive", sessionId, () -> sessionRepo.existsById(sessionId));
    }

    /** Ids of sessions whose last message is strictly older than {@code cutoff}. */
    public List<String> findIdleSince(Instant cutoff) {
        return storeLock.call("findIdleSince", null, () -> sessionRepo.findByUpdatedAtBefore(cutoff)
                .stream()
                .map(ActiveSession::getSessionId)
                .toList());
    }

    public List<ActiveSession> listActive() {
        return storeLock.call("listActive", null, sessionRepo::findAllByOrderByUpdatedAtDesc);
    }

    public long countActive() {
        return storeLock.call("countActive", null, sessionRepo::count);
    }

    public void clear(String sessionId) {
        storeLock.run("clear", sessionId, () -> {
            messageRepo.deleteBySessionId(sessionId);
            intelRepo.deleteById(sessionId);
            sessionRepo.deleteById(sessionId);
            log.debug("Active session cleared [sessionId={}]", sessionId);
        });
    }

    public long clearAll() {
        return storeLock.call("clearAll", null, () -> {
            long count = sessionRepo.count();
            messageRepo.deleteAll();
            intelRepo.deleteAll();
            sessionRepo.deleteAll();
            log.info("Cleared all active sessions [count={}]", count);
            return count;
        });
    }

    private SessionMessage append(ActiveSession session,
                                  Sender sender,
                                  String text,
                                  boolean isResponse,
                                  boolean isScamFlag,
                                  Instant now) {
        session.setUpdatedAt(now);
        int seq = session.nextSeq();
        if (isScamFlag) {
            session.recordScamFlag(properties.getSession().getConfirmThreshold());
        }
        sessionRepo.save(session);

        SessionMessage message = SessionMessage.builder()
                .sessionId(session.getSessionId())
                .seq(seq)
                .sender(sender)
                .text(text)
                .timestamp(now)
                .response(isResponse)
                .scamFlag(isScamFlag)
                .build();
        SessionMessage saved = messageRepo.save(message);

        log.debug("Message appended [sessionId={}, seq={}, sender={}, flagged={}, scamFlags={}]",
                session.getSessionId(), seq, sender, isScamFlag, session.getScamFlags());
        return saved;
    }

    private ActiveSession openSession(String sessionId, SessionMetadata metadata, Instant now) {
        HoneypotProperties.Session defaults = properties.getSession();
        ActiveSession session = ActiveSession.builder()
                .sessionId(sessionId)
                .channel(valueOrDefault(metadata == null ? null : metadata.getChannel(), defaults.getDefaultChannel()))
                .language(valueOrDefault(metadata == null ? null : metadata.getLanguage(), defaults.getDefaultLanguage()))
                .locale(valueOrDefault(metadata == null ? null : metadata.getLocale(), defaults.getDefaultLocale()))
                .createdAt(now)
                .updatedAt(now)
                .build();
        log.info("Session opened [sessionId={}, channel={}]", sessionId, session.getChannel());
        return session;
    }

    private static String valueOrDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
