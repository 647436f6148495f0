package com.deepansh.honeypot.archive;

import com.deepansh.honeypot.model.Sender;
import com.deepansh.honeypot.session.ActiveSession;
import com.deepansh.honeypot.session.FullSession;
import com.deepansh.honeypot.session.SessionMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Permanent record of a finished conversation, scam or not.
 * Messages are embedded in seq order; re-archiving the same id overwrites.
 */
@Document(collection = "archived_sessions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivedSession {

    @Id
    private String sessionId;

    private String channel;
    private String language;
    private String locale;

    private int totalMessages;
    private boolean scam;
    private int scamFlagsCount;

    private Instant createdAt;

    @Indexed
    private Instant completedAt;

    @Builder.Default
    private List<ArchivedMessage> messages = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ArchivedMessage {
        private int seq;
        private Sender sender;
        private String text;
        private Instant timestamp;
        private boolean response;
        private boolean scamFlag;

        static ArchivedMessage of(SessionMessage m) {
            return ArchivedMessage.builder()
                    .seq(m.getSeq())
                    .sender(m.getSender())
                    .text(m.getText())
                    .timestamp(m.getTimestamp())
                    .response(m.isResponse())
                    .scamFlag(m.isScamFlag())
                    .build();
        }
    }

    public static ArchivedSession snapshotOf(FullSession full, Instant completedAt) {
        ActiveSession header = full.session();
        return ArchivedSession.builder()
                .sessionId(header.getSessionId())
                .channel(header.getChannel())
                .language(header.getLanguage())
                .locale(header.getLocale())
                .totalMessages(full.totalMessages())
                .scam(header.isConfirmedScam())
                .scamFlagsCount(header.getScamFlags())
                .createdAt(header.getCreatedAt())
                .completedAt(completedAt)
                .messages(new ArrayList<>(full.messages().stream().map(ArchivedMessage::of).toList()))
                .build();
    }
}
