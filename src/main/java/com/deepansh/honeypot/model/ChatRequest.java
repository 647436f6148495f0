package com.deepansh.honeypot.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Inbound turn. Every field is optional: the platform that calls us is
 * loose about its payload, so text may arrive as {@code message},
 * {@code message.text}, {@code text} or {@code content}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatRequest {

    @JsonAlias("session_id")
    private String sessionId;

    private TurnMessage message;

    private String text;

    private String content;

    @Builder.Default
    private List<TurnMessage> conversationHistory = new ArrayList<>();

    private SessionMetadata metadata;

    /** First non-blank text among the accepted shapes, or empty. */
    public String resolveText() {
        if (message != null && message.getText() != null && !message.getText().isBlank()) {
            return message.getText();
        }
        if (text != null && !text.isBlank()) return text;
        if (content != null && !content.isBlank()) return content;
        return "";
    }

    public Sender resolveSender() {
        return message != null ? Sender.fromLabel(message.getSender()) : Sender.scammer;
    }

    public List<TurnMessage> historyOrEmpty() {
        return conversationHistory != null ? conversationHistory : List.of();
    }
}
