package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.Evidence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the extraction pass's raw completion into {@link Evidence}.
 *
 * The model is asked for strict JSON but routinely wraps it in markdown
 * fences or prose. Guards, in order:
 *   1. null / blank → empty
 *   2. fenced block → its inside
 *   3. first '{' to last '}' → the candidate object
 *   4. parse failure → empty
 * Missing or non-array fields become empty sets; non-string entries are dropped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EvidenceParser {

    private final ObjectMapper objectMapper;

    public record ExtractionResult(Evidence evidence, String agentNotes) {
        public static ExtractionResult empty() {
            return new ExtractionResult(Evidence.empty(), "");
        }
    }

    public ExtractionResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ExtractionResult.empty();
        }

        String candidate = extractJsonObject(stripFences(raw.strip()));
        if (candidate == null) {
            log.warn("Extraction response has no JSON object. First 100 chars: '{}'",
                    raw.substring(0, Math.min(100, raw.length())));
            return ExtractionResult.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse extraction JSON, treating as empty: {}", e.getOriginalMessage());
            return ExtractionResult.empty();
        }
        if (root == null || !root.isObject()) {
            return ExtractionResult.empty();
        }

        // Some models drop the wrapper and return the five arrays at top level
        JsonNode intel = root.path("extractedIntelligence");
        if (!intel.isObject()) {
            intel = root;
        }

        Evidence evidence = Evidence.of(
                strings(intel, "bankAccounts"),
                strings(intel, "upiIds"),
                strings(intel, "phishingLinks"),
                strings(intel, "phoneNumbers"),
                strings(intel, "suspiciousKeywords"));

        JsonNode notes = root.path("agentNotes");
        return new ExtractionResult(evidence, notes.isTextual() ? notes.asText().strip() : "");
    }

    private String stripFences(String content) {
        int json = content.indexOf("```json");
        if (json >= 0) {
            return untilFence(content.substring(json + "```json".length()));
        }
        int plain = content.indexOf("```");
        if (plain >= 0) {
            return untilFence(content.substring(plain + 3));
        }
        return content;
    }

    private String untilFence(String rest) {
        int end = rest.indexOf("```");
        return end >= 0 ? rest.substring(0, end) : rest;
    }

    private String extractJsonObject(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        return start >= 0 && end > start ? content.substring(start, end + 1) : null;
    }

    private List<String> strings(JsonNode parent, String field) {
        JsonNode node = parent.path(field);
        List<String> values = new ArrayList<>();
        if (!node.isArray()) {
            return values;
        }
        node.forEach(item -> {
            if (item.isTextual()) {
                values.add(item.asText());
            }
        });
        return values;
    }
}
