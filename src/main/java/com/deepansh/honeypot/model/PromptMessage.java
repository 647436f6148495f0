package com.deepansh.honeypot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One chat-completions message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptMessage {

    public enum Role {
        system, user, assistant
    }

    private Role role;
    private String content;

    public static PromptMessage system(String content) {
        return new PromptMessage(Role.system, content);
    }

    public static PromptMessage user(String content) {
        return new PromptMessage(Role.user, content);
    }

    public static PromptMessage assistant(String content) {
        return new PromptMessage(Role.assistant, content);
    }
}
