package com.deepansh.honeypot.lifecycle;

public record FinalizationResult(
        String sessionId,
        boolean scam,
        int scamFlags,
        int totalMessages,
        boolean pushed
) {
}
