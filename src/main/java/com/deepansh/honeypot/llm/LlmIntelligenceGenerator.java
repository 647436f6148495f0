package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.LlmResponse;
import com.deepansh.honeypot.model.PromptMessage;
import com.deepansh.honeypot.model.Sender;
import com.deepansh.honeypot.model.TurnMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Two LLM passes per inbound message.
 *
 * 1. Persona pass: the conversation replayed with our side as assistant,
 *    the scammer as user, answered in character. Short and warm
 *    (temperature 0.7, 100 tokens).
 * 2. Extraction pass: the whole transcript, including the reply just
 *    generated, with a strict-JSON instruction. Cold and longer
 *    (temperature 0.1, 512 tokens).
 *
 * The LlmClient injected is the resilient decorator, so transport
 * failures already arrive here as empty content. Anything else that
 * escapes is caught; callers never see an exception.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LlmIntelligenceGenerator implements IntelligenceGenerator {

    static final String EMPTY_REPLY_FALLBACK = "Sorry sir, I didn't understand. Can you repeat?";

    private static final CompletionSettings PERSONA_SETTINGS = new CompletionSettings(100, 0.7, 0.9);
    private static final CompletionSettings EXTRACTION_SETTINGS = new CompletionSettings(512, 0.1, 0.7);

    private final LlmClient llmClient;
    private final ReplySanitizer replySanitizer;
    private final EvidenceParser evidenceParser;

    @Override
    public GeneratedTurn generate(String currentMessage, List<TurnMessage> history, String sessionId) {
        try {
            log.info("Generating reply [sessionId={}, historySize={}]", sessionId, history.size());
            String reply = personaReply(currentMessage, history);

            String transcript = transcript(currentMessage, history, reply);
            EvidenceParser.ExtractionResult extraction = extract(transcript);

            log.debug("Turn generated [sessionId={}, replyLength={}, evidenceItems={}]",
                    sessionId, reply.length(), extraction.evidence().size());
            return new GeneratedTurn(reply, extraction.evidence(), extraction.agentNotes());

        } catch (RuntimeException e) {
            log.error("Generation failed, degrading to empty turn [sessionId={}]: {}", sessionId, e.getMessage());
            return GeneratedTurn.empty();
        }
    }

    private String personaReply(String currentMessage, List<TurnMessage> history) {
        List<PromptMessage> messages = new ArrayList<>();
        messages.add(PromptMessage.system(HoneypotPrompts.PERSONA));
        for (TurnMessage m : history) {
            String text = m.getText() != null ? m.getText() : "";
            messages.add(Sender.fromLabel(m.getSender()) == Sender.user
                    ? PromptMessage.assistant(text)
                    : PromptMessage.user(text));
        }
        messages.add(PromptMessage.user(HoneypotPrompts.personaTurn(currentMessage)));

        LlmResponse response = llmClient.chat(messages, PERSONA_SETTINGS);
        String raw = response.getContent();
        if (raw == null || raw.isBlank()) {
            // upstream failure; the caller substitutes its own filler
            return "";
        }

        String cleaned = replySanitizer.clean(raw);
        return cleaned.isEmpty() ? EMPTY_REPLY_FALLBACK : cleaned;
    }

    private EvidenceParser.ExtractionResult extract(String transcript) {
        String prompt = HoneypotPrompts.EXTRACTION + "\n\nConversation:\n" + transcript;
        LlmResponse response = llmClient.chat(List.of(PromptMessage.user(prompt)), EXTRACTION_SETTINGS);
        return evidenceParser.parse(response.getContent());
    }

    private String transcript(String currentMessage, List<TurnMessage> history, String reply) {
        StringBuilder sb = new StringBuilder();
        for (TurnMessage m : history) {
            sb.append(Sender.fromLabel(m.getSender()).name())
              .append(": ")
              .append(m.getText() != null ? m.getText() : "")
              .append("\n");
        }
        sb.append("scammer: ").append(currentMessage).append("\n");
        if (!reply.isEmpty()) {
            sb.append("user: ").append(reply).append("\n");
        }
        return sb.toString();
    }
}
