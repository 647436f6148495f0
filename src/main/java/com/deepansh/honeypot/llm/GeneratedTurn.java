package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.Evidence;

/**
 * What the generator produced for one inbound message.
 * Never null fields: a failed pass yields "" / empty evidence.
 */
public record GeneratedTurn(String reply, Evidence evidence, String agentNotes) {

    public static GeneratedTurn empty() {
        return new GeneratedTurn("", Evidence.empty(), "");
    }
}
