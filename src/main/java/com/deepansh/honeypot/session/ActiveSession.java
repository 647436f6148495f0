package com.deepansh.honeypot.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Header of a live conversation. Removed once the session is finalized.
 */
@Document(collection = "active_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveSession {

    @Id
    private String sessionId;

    private String channel;
    private String language;
    private String locale;

    @Builder.Default
    private int scamFlags = 0;

    @Builder.Default
    private boolean confirmedScam = false;

    /** Last assigned message seq */
    @Builder.Default
    private int messageCount = 0;

    private Instant createdAt;

    /** Bumped on every appended message; the sweeper's idleness clock */
    @Indexed
    private Instant updatedAt;

    /**
     * Counts one more flagged turn. Confirmation latches: once set it
     * stays set even if the threshold is later raised.
     */
    public void recordScamFlag(int confirmThreshold) {
        scamFlags++;
        if (scamFlags >= confirmThreshold) {
            confirmedScam = true;
        }
    }

    public int nextSeq() {
        return ++messageCount;
    }
}
