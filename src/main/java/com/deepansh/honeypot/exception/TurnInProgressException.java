package com.deepansh.honeypot.exception;

import lombok.Getter;

/**
 * A request carrying this Idempotency-Key is still being handled. The
 * client should retry later and will then receive the cached reply.
 */
@Getter
public class TurnInProgressException extends HoneypotException {

    private final String idempotencyKey;

    public TurnInProgressException(String idempotencyKey) {
        super("A request with Idempotency-Key " + idempotencyKey + " is still in progress, retry later");
        this.idempotencyKey = idempotencyKey;
    }
}
