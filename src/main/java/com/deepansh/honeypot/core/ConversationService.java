package com.deepansh.honeypot.core;

import com.deepansh.honeypot.config.HoneypotProperties;
import com.deepansh.honeypot.llm.GeneratedTurn;
import com.deepansh.honeypot.llm.IntelligenceGenerator;
import com.deepansh.honeypot.model.ChatRequest;
import com.deepansh.honeypot.model.ScamStatus;
import com.deepansh.honeypot.model.Sender;
import com.deepansh.honeypot.observability.HoneypotMetrics;
import com.deepansh.honeypot.scoring.RiskAssessment;
import com.deepansh.honeypot.scoring.RiskScorer;
import com.deepansh.honeypot.session.ActiveSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Handles one inbound message end to end:
 *
 *   1. Resolve session id (generate one if the caller sent none)
 *   2. Score the text; flag it above the configured confidence
 *   3. Append the inbound message
 *   4. Generate the persona reply + evidence (never throws)
 *   5. Append our reply, substituting filler if the generator came back empty,
 *      unless the session was finalized in the meantime
 *   6. Merge evidence into the session (skipped along with the reply)
 *   7. Read back the scam status
 *
 * Storage failures propagate; the caller turns them into a 500.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConversationService {

    static final String EMPTY_TEXT_PLACEHOLDER = "Hello";
    static final String FALLBACK_REPLY = "Sorry sir, network issue. Can you repeat?";

    private final ActiveSessionStore activeStore;
    private final RiskScorer riskScorer;
    private final IntelligenceGenerator generator;
    private final HoneypotMetrics metrics;
    private final HoneypotProperties properties;

    public TurnResult handleTurn(ChatRequest request) {
        long start = System.currentTimeMillis();
        metrics.recordRequest();

        String sessionId = resolveSessionId(request.getSessionId());
        String text = request.resolveText();
        if (text.isBlank()) {
            log.warn("Empty message text received, using placeholder [sessionId={}]", sessionId);
            text = EMPTY_TEXT_PLACEHOLDER;
        }

        RiskAssessment risk = riskScorer.score(text);
        boolean flagged = risk.confidence() > properties.getScoring().getFlagConfidence();
        if (flagged) {
            metrics.recordFlaggedTurn();
        }
        log.info("Turn received [sessionId={}, type={}, confidence={}, flagged={}]",
                sessionId, risk.scamType(), risk.confidence(), flagged);

        boolean wasConfirmed = activeStore.getScamStatus(sessionId).confirmedScam();
        activeStore.appendMessage(sessionId, request.resolveSender(), text, false, flagged, request.getMetadata());

        GeneratedTurn generated = generator.generate(text, request.historyOrEmpty(), sessionId);
        String reply = generated.reply() == null || generated.reply().isBlank()
                ? FALLBACK_REPLY
                : generated.reply();

        if (activeStore.appendIfActive(sessionId, Sender.user, reply, true).isPresent()) {
            activeStore.mergeIntelligence(sessionId, generated.evidence(), generated.agentNotes());
        } else {
            log.warn("Session ended while the reply was being generated, reply not stored [sessionId={}]", sessionId);
        }

        ScamStatus status = activeStore.getScamStatus(sessionId);
        if (status.confirmedScam()) {
            if (!wasConfirmed) {
                metrics.recordConfirmedSession();
            }
            log.info("Session CONFIRMED as scam [sessionId={}, flags={}]", sessionId, status.scamFlags());
        }

        log.info("Turn processed [sessionId={}, latencyMs={}]", sessionId, System.currentTimeMillis() - start);
        return new TurnResult(sessionId, reply, flagged, status);
    }

    private String resolveSessionId(String sessionId) {
        return (sessionId != null && !sessionId.isBlank())
                ? sessionId
                : UUID.randomUUID().toString();
    }
}
