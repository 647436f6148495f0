package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.TurnMessage;

import java.util.List;

/**
 * Produces the honeypot's reply and the evidence visible so far.
 * Implementations must not throw; failures degrade to {@link GeneratedTurn#empty()}.
 */
public interface IntelligenceGenerator {

    GeneratedTurn generate(String currentMessage, List<TurnMessage> history, String sessionId);
}
