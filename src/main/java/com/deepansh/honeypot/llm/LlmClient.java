package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.model.LlmResponse;
import com.deepansh.honeypot.model.PromptMessage;

import java.util.List;

public interface LlmClient {

    /**
     * One chat-completions round trip.
     *
     * @param messages  prompt, in order (system first if present)
     * @param settings  sampling overrides for this call
     */
    LlmResponse chat(List<PromptMessage> messages, CompletionSettings settings);
}
