package com.deepansh.honeypot.session;

import com.deepansh.honeypot.model.Evidence;

import java.util.List;

/**
 * Consistent read of everything the active store holds for one session.
 * Messages are in seq order; evidence is empty, never null, when nothing
 * has been merged yet.
 */
public record FullSession(
        ActiveSession session,
        List<SessionMessage> messages,
        Evidence evidence,
        String agentNotes
) {
    public String sessionId() {
        return session.getSessionId();
    }

    public int totalMessages() {
        return messages.size();
    }
}
