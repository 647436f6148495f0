package com.deepansh.honeypot.intel;

import com.deepansh.honeypot.model.Evidence;
import com.deepansh.honeypot.model.ReportPayload;
import com.deepansh.honeypot.session.FullSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Evidence snapshot of a confirmed scam, waiting to be (or already)
 * reported to the external evaluator.
 */
@Document(collection = "scam_intelligence")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScamIntelligenceRecord {

    @Id
    private String sessionId;

    @Builder.Default
    private boolean scamDetected = true;

    private int totalMessagesExchanged;

    @Builder.Default
    private Evidence evidence = new Evidence();

    private String agentNotes;

    /** One-way false to true */
    @Indexed
    private boolean pushedToExternal;

    private Instant createdAt;
    private Instant pushedAt;

    public static ScamIntelligenceRecord snapshotOf(FullSession full, Instant now) {
        return ScamIntelligenceRecord.builder()
                .sessionId(full.sessionId())
                .totalMessagesExchanged(full.totalMessages())
                .evidence(Evidence.empty().union(full.evidence()))
                .agentNotes(full.agentNotes() != null ? full.agentNotes() : "")
                .pushedToExternal(false)
                .createdAt(now)
                .build();
    }

    public ReportPayload toPayload() {
        return new ReportPayload(
                sessionId,
                true,
                totalMessagesExchanged,
                ReportPayload.ExtractedIntelligence.from(evidence),
                agentNotes != null ? agentNotes : "");
    }
}
