package com.deepansh.honeypot.model;

import java.util.List;

/**
 * Body POSTed to the external evaluator for a confirmed scam session.
 * Field names are the evaluator's wire names.
 */
public record ReportPayload(
        String sessionId,
        boolean scamDetected,
        int totalMessagesExchanged,
        ExtractedIntelligence extractedIntelligence,
        String agentNotes
) {

    public record ExtractedIntelligence(
            List<String> bankAccounts,
            List<String> upiIds,
            List<String> phishingLinks,
            List<String> phoneNumbers,
            List<String> suspiciousKeywords
    ) {
        public static ExtractedIntelligence from(Evidence evidence) {
            Evidence e = evidence != null ? evidence : Evidence.empty();
            return new ExtractedIntelligence(
                    List.copyOf(e.getBankAccounts()),
                    List.copyOf(e.getUpiIds()),
                    List.copyOf(e.getPhishingLinks()),
                    List.copyOf(e.getPhoneNumbers()),
                    List.copyOf(e.getSuspiciousKeywords()));
        }
    }
}
