package com.deepansh.honeypot.scoring;

import java.util.List;
import java.util.Map;

/**
 * Keyword score for one message.
 *
 * @param detectedKeywords category → keywords found, only categories with a hit
 */
public record RiskAssessment(
        String scamType,
        double confidence,
        Map<String, List<String>> detectedKeywords,
        RiskLevel riskLevel
) {
    public enum RiskLevel { LOW, MEDIUM, HIGH }

    public static RiskAssessment none() {
        return new RiskAssessment(KeywordRiskScorer.UNKNOWN, 0.0, Map.of(), RiskLevel.LOW);
    }
}
