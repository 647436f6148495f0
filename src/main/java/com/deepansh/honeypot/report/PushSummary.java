package com.deepansh.honeypot.report;

/** Outcome of one push-all-pending run. */
public record PushSummary(boolean enabled, int totalPending, int success, int failed) {

    public static PushSummary disabled() {
        return new PushSummary(false, 0, 0, 0);
    }
}
