package com.deepansh.honeypot.exception;

import lombok.Getter;

/**
 * The session id is not present in the active store.
 * Non-fatal: nothing was mutated.
 */
@Getter
public class SessionNotFoundException extends HoneypotException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session " + sessionId + " not found");
        this.sessionId = sessionId;
    }
}
