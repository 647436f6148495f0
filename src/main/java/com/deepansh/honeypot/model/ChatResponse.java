package com.deepansh.honeypot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Shape the calling platform expects back: {@code {"status":"success","reply":"..."}}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private String status;
    private String reply;
    private String sessionId;

    public static ChatResponse success(String sessionId, String reply) {
        return ChatResponse.builder().status("success").sessionId(sessionId).reply(reply).build();
    }
}
