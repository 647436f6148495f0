package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.LlmResponse;
import com.deepansh.honeypot.model.PromptMessage;
import com.deepansh.honeypot.model.TurnMessage;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmIntelligenceGeneratorTest {

    private static final String EXTRACTION_JSON =
            "{\"extractedIntelligence\": {\"upiIds\": [\"fraud@ybl\"]}, \"agentNotes\": \"UPI collect scam\"}";

    @Mock LlmClient llmClient;
    @Captor ArgumentCaptor<List<PromptMessage>> messagesCaptor;
    @Captor ArgumentCaptor<CompletionSettings> settingsCaptor;

    private LlmIntelligenceGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new LlmIntelligenceGenerator(llmClient, new ReplySanitizer(), new EvidenceParser(new ObjectMapper()));
    }

    @Test
    void generate_returnsCleanReplyAndParsedEvidence() {
        when(llmClient.chat(anyList(), any()))
                .thenReturn(content("Amit: Oh god sir! What is your UPI ID?"))
                .thenReturn(content(EXTRACTION_JSON));

        GeneratedTurn turn = generator.generate("Pay to fraud@ybl now", List.of(), "s1");

        assertThat(turn.reply()).isEqualTo("Oh god sir! What is your UPI ID?");
        assertThat(turn.evidence().getUpiIds()).containsExactly("fraud@ybl");
        assertThat(turn.agentNotes()).isEqualTo("UPI collect scam");
    }

    @Test
    void generate_personaPrompt_replaysHistoryWithOurSideAsAssistant() {
        when(llmClient.chat(anyList(), any()))
                .thenReturn(content("Which bank sir?"))
                .thenReturn(content("{}"));
        List<TurnMessage> history = List.of(
                TurnMessage.builder().sender("scammer").text("Your account is blocked").build(),
                TurnMessage.builder().sender("user").text("What? Why sir?").build());

        generator.generate("Share OTP", history, "s1");

        verify(llmClient, times(2)).chat(messagesCaptor.capture(), settingsCaptor.capture());
        List<PromptMessage> persona = messagesCaptor.getAllValues().get(0);
        assertThat(persona).extracting(PromptMessage::getRole).containsExactly(
                PromptMessage.Role.system, PromptMessage.Role.user, PromptMessage.Role.assistant, PromptMessage.Role.user);
        assertThat(persona.get(3).getContent()).contains("Share OTP");
        assertThat(settingsCaptor.getAllValues().get(0)).isEqualTo(new CompletionSettings(100, 0.7, 0.9));
        assertThat(settingsCaptor.getAllValues().get(1)).isEqualTo(new CompletionSettings(512, 0.1, 0.7));
    }

    @Test
    void generate_extractionTranscript_includesGeneratedReply() {
        when(llmClient.chat(anyList(), any()))
                .thenReturn(content("Please give your number sir"))
                .thenReturn(content("{}"));

        generator.generate("Call me on 9000000000", List.of(), "s1");

        verify(llmClient, times(2)).chat(messagesCaptor.capture(), any());
        String prompt = messagesCaptor.getAllValues().get(1).get(0).getContent();
        assertThat(prompt)
                .contains("scammer: Call me on 9000000000")
                .contains("user: Please give your number sir");
    }

    @Test
    void generate_blankPersonaContent_returnsEmptyReplyButStillExtracts() {
        when(llmClient.chat(anyList(), any()))
                .thenReturn(LlmResponse.empty())
                .thenReturn(content(EXTRACTION_JSON));

        GeneratedTurn turn = generator.generate("Pay now", List.of(), "s1");

        assertThat(turn.reply()).isEmpty();
        assertThat(turn.evidence().getUpiIds()).containsExactly("fraud@ybl");
    }

    @Test
    void generate_replyThatCleansToNothing_usesFiller() {
        when(llmClient.chat(anyList(), any()))
                .thenReturn(content("Sure!"))
                .thenReturn(content("{}"));

        GeneratedTurn turn = generator.generate("Hello", List.of(), "s1");

        assertThat(turn.reply()).isEqualTo(LlmIntelligenceGenerator.EMPTY_REPLY_FALLBACK);
    }

    @Test
    void generate_clientThrows_degradesToEmptyTurn() {
        when(llmClient.chat(anyList(), any())).thenThrow(new IllegalStateException("boom"));

        GeneratedTurn turn = generator.generate("Hello", List.of(), "s1");

        assertThat(turn).isEqualTo(GeneratedTurn.empty());
    }

    private static LlmResponse content(String text) {
        return LlmResponse.builder().content(text).build();
    }
}
