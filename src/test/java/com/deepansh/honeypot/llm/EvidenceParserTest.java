package com.deepansh.honeypot.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceParserTest {

    private final EvidenceParser parser = new EvidenceParser(new ObjectMapper());

    @Test
    void parse_fencedWrappedJson_extractsAllFields() {
        String raw = """
                Here is the analysis:
                ```json
                {"scamDetected": true,
                 "extractedIntelligence": {
                   "bankAccounts": ["123456789012"],
                   "upiIds": ["fraud@ybl"],
                   "phishingLinks": ["http://kyc-update.example"],
                   "phoneNumbers": ["+919876543210"],
                   "suspiciousKeywords": ["urgent", "blocked"]},
                 "agentNotes": "  Bank KYC scam  "}
                ```
                """;

        EvidenceParser.ExtractionResult result = parser.parse(raw);

        assertThat(result.evidence().getBankAccounts()).containsExactly("123456789012");
        assertThat(result.evidence().getUpiIds()).containsExactly("fraud@ybl");
        assertThat(result.evidence().getPhishingLinks()).containsExactly("http://kyc-update.example");
        assertThat(result.evidence().getPhoneNumbers()).containsExactly("+919876543210");
        assertThat(result.evidence().getSuspiciousKeywords()).containsExactly("urgent", "blocked");
        assertThat(result.agentNotes()).isEqualTo("Bank KYC scam");
    }

    @Test
    void parse_objectInsideProse_isFound() {
        String raw = "Sure! {\"extractedIntelligence\": {\"upiIds\": [\"a@paytm\"]}} hope this helps";

        assertThat(parser.parse(raw).evidence().getUpiIds()).containsExactly("a@paytm");
    }

    @Test
    void parse_flatShape_isAccepted() {
        String raw = "{\"upiIds\": [\"x@ybl\"], \"phoneNumbers\": [\"9000000000\"], \"agentNotes\": \"flat\"}";

        EvidenceParser.ExtractionResult result = parser.parse(raw);

        assertThat(result.evidence().getUpiIds()).containsExactly("x@ybl");
        assertThat(result.evidence().getPhoneNumbers()).containsExactly("9000000000");
        assertThat(result.agentNotes()).isEqualTo("flat");
    }

    @Test
    void parse_wrongTypes_areDropped() {
        String raw = "{\"extractedIntelligence\": {\"upiIds\": \"not-a-list\", "
                + "\"phoneNumbers\": [12345, \"9000000000\", null, \" \"]}, \"agentNotes\": 42}";

        EvidenceParser.ExtractionResult result = parser.parse(raw);

        assertThat(result.evidence().getUpiIds()).isEmpty();
        assertThat(result.evidence().getPhoneNumbers()).containsExactly("9000000000");
        assertThat(result.agentNotes()).isEmpty();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
            "I could not find anything",
            "{not json at all}",
            "[\"a\", \"b\"]",
            "} backwards {"
    })
    void parse_unusable_isEmpty(String raw) {
        EvidenceParser.ExtractionResult result = parser.parse(raw);

        assertThat(result.evidence().isEmpty()).isTrue();
        assertThat(result.agentNotes()).isEmpty();
    }
}
