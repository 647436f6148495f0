package com.deepansh.honeypot.core;

import com.deepansh.honeypot.model.ScamStatus;

/**
 * Outcome of one handled turn.
 *
 * @param flagged whether the inbound message itself was flagged risky
 */
public record TurnResult(String sessionId, String reply, boolean flagged, ScamStatus status) {
}
