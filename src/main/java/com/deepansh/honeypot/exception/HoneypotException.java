package com.deepansh.honeypot.exception;

/**
 * Base type for every failure the honeypot surfaces to its callers.
 * Unchecked: callers either let it reach {@link GlobalExceptionHandler}
 * or catch the specific subtype they can recover from.
 */
public class HoneypotException extends RuntimeException {

    public HoneypotException(String message) {
        super(message);
    }

    public HoneypotException(String message, Throwable cause) {
        super(message, cause);
    }
}
