package com.deepansh.honeypot.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Honeypot counters, registered on the Micrometer registry under
 * {@code honeypot.*}.
 *
 * GET /metrics is a view over these meters. The meters themselves are
 * monotonic; {@link #reset()} moves the baseline the view counts from,
 * so a data wipe starts /metrics at zero without touching what the
 * registry has already exported.
 */
@Component
public class HoneypotMetrics {

    private final Counter requestsReceived;
    private final Counter scamTurnsFlagged;
    private final Counter sessionsConfirmed;
    private final Counter sessionsFinalized;
    private final Map<Counter, Double> baselines = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Instant startedAt;

    public HoneypotMetrics(MeterRegistry registry, Clock clock) {
        this.requestsReceived = Counter.builder("honeypot.requests.received")
                .description("Inbound chat turns")
                .register(registry);
        this.scamTurnsFlagged = Counter.builder("honeypot.turns.flagged")
                .description("Inbound turns scored above the flag confidence")
                .register(registry);
        this.sessionsConfirmed = Counter.builder("honeypot.sessions.confirmed")
                .description("Sessions that reached the confirmation threshold")
                .register(registry);
        this.sessionsFinalized = Counter.builder("honeypot.sessions.finalized")
                .description("Sessions moved to the archive")
                .register(registry);
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void recordRequest() {
        requestsReceived.increment();
    }

    public void recordFlaggedTurn() {
        scamTurnsFlagged.increment();
    }

    public void recordConfirmedSession() {
        sessionsConfirmed.increment();
    }

    public void recordFinalized(int count) {
        if (count > 0) {
            sessionsFinalized.increment(count);
        }
    }

    public long requestsReceived() {
        return sinceReset(requestsReceived);
    }

    public long scamTurnsFlagged() {
        return sinceReset(scamTurnsFlagged);
    }

    public void reset() {
        for (Counter counter : List.of(requestsReceived, scamTurnsFlagged, sessionsConfirmed, sessionsFinalized)) {
            baselines.put(counter, counter.count());
        }
    }

    public Map<String, Object> snapshot(long activeSessions, long pendingReports) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("requestsReceived", sinceReset(requestsReceived));
        stats.put("scamsDetected", sinceReset(scamTurnsFlagged));
        stats.put("sessionsConfirmed", sinceReset(sessionsConfirmed));
        stats.put("sessionsFinalized", sinceReset(sessionsFinalized));
        stats.put("activeSessions", activeSessions);
        stats.put("pendingReports", pendingReports);
        stats.put("uptimeSeconds", Duration.between(startedAt, clock.instant()).toSeconds());
        return stats;
    }

    private long sinceReset(Counter counter) {
        return (long) (counter.count() - baselines.getOrDefault(counter, 0.0));
    }
}
