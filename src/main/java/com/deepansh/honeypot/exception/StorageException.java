package com.deepansh.honeypot.exception;

import lombok.Getter;

/**
 * A read or write against one of the backing stores failed.
 * Fatal for the operation that raised it; no partial state should be trusted.
 */
@Getter
public class StorageException extends HoneypotException {

    private final String operation;
    private final String sessionId;

    public StorageException(String operation, String sessionId, Throwable cause) {
        super("Storage failure during " + operation
                + (sessionId != null ? " [sessionId=" + sessionId + "]" : ""), cause);
        this.operation = operation;
        this.sessionId = sessionId;
    }
}
