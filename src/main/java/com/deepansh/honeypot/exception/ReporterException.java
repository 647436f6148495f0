package com.deepansh.honeypot.exception;

/** The external evaluator rejected a push or could not be reached. */
public class ReporterException extends HoneypotException {

    public ReporterException(String message) {
        super(message);
    }

    public ReporterException(String message, Throwable cause) {
        super(message, cause);
    }
}
