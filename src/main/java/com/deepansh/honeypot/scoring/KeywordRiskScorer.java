package com.deepansh.honeypot.scoring;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Substring keyword scorer.
 *
 * Each keyword found adds 10 points; confidence is points / 100 capped at
 * 1.0. Matching is plain case-insensitive containment, so "now" also hits
 * inside "know".
 *
 * Scam type precedence: banking, lottery, intimidation, generic.
 */
@Component
@Slf4j
public class KeywordRiskScorer implements RiskScorer {

    public static final String BANKING_FRAUD = "banking_fraud";
    public static final String LOTTERY_SCAM = "lottery_scam";
    public static final String INTIMIDATION_SCAM = "intimidation_scam";
    public static final String GENERIC_SCAM = "generic_scam";
    public static final String UNKNOWN = "unknown";

    private static final int POINTS_PER_HIT = 10;

    private static final Map<String, List<String>> KEYWORDS;

    static {
        Map<String, List<String>> k = new LinkedHashMap<>();
        k.put("urgency", List.of("immediately", "urgent", "today", "now", "hurry", "fast", "quick", "limited time"));
        k.put("banking", List.of("bank", "account", "blocked", "suspended", "verify", "upi", "otp", "pin", "password"));
        k.put("money", List.of("money", "payment", "transfer", "cash", "lottery", "prize", "won", "reward"));
        k.put("threat", List.of("blocked", "suspended", "legal", "police", "arrest", "court", "fine"));
        k.put("action", List.of("click", "call", "share", "send", "provide", "confirm", "update"));
        KEYWORDS = Collections.unmodifiableMap(k);
    }

    @Override
    public RiskAssessment score(String text) {
        if (text == null || text.isBlank()) {
            return RiskAssessment.none();
        }

        String lower = text.toLowerCase(Locale.ROOT);
        Map<String, List<String>> detected = new LinkedHashMap<>();
        int score = 0;

        for (Map.Entry<String, List<String>> category : KEYWORDS.entrySet()) {
            List<String> found = category.getValue().stream()
                    .filter(lower::contains)
                    .toList();
            if (!found.isEmpty()) {
                detected.put(category.getKey(), found);
                score += found.size() * POINTS_PER_HIT;
            }
        }

        double confidence = BigDecimal.valueOf(Math.min(score / 100.0, 1.0))
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();

        RiskAssessment assessment = new RiskAssessment(
                scamType(lower, detected, score),
                confidence,
                Collections.unmodifiableMap(detected),
                riskLevel(confidence));

        log.debug("Scored message [type={}, confidence={}, categories={}]",
                assessment.scamType(), confidence, detected.keySet());
        return assessment;
    }

    private String scamType(String lower, Map<String, List<String>> detected, int score) {
        if (detected.containsKey("banking") || lower.contains("upi")) return BANKING_FRAUD;
        if (lower.contains("lottery") || lower.contains("prize") || lower.contains("won")) return LOTTERY_SCAM;
        if (detected.containsKey("threat")) return INTIMIDATION_SCAM;
        if (score > 0) return GENERIC_SCAM;
        return UNKNOWN;
    }

    private RiskAssessment.RiskLevel riskLevel(double confidence) {
        if (confidence > 0.5) return RiskAssessment.RiskLevel.HIGH;
        if (confidence > 0.2) return RiskAssessment.RiskLevel.MEDIUM;
        return RiskAssessment.RiskLevel.LOW;
    }
}
