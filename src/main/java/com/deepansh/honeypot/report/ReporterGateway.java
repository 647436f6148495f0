package com.deepansh.honeypot.report;

import com.deepansh.honeypot.model.ReportPayload;

/**
 * Outbound channel to the external evaluator.
 */
public interface ReporterGateway {

    /**
     * Deliver one confirmed-scam snapshot.
     *
     * @return true only when the evaluator acknowledged the payload
     * @throws com.deepansh.honeypot.exception.ReporterException on rejection or transport failure,
     *         unless the implementation maps failures to {@code false} itself
     */
    boolean push(ReportPayload payload);

    boolean isEnabled();
}
