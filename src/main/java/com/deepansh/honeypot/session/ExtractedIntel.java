package com.deepansh.honeypot.session;

import com.deepansh.honeypot.model.Evidence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/** Evidence accumulated so far for one active session. */
@Document(collection = "extracted_intel")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedIntel {

    @Id
    private String sessionId;

    @Builder.Default
    private Evidence evidence = new Evidence();

    private String agentNotes;

    private Instant updatedAt;
}
