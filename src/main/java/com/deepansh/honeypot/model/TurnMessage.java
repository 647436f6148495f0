package com.deepansh.honeypot.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message as it appears on the wire, either as the current inbound
 * message or as an entry in the caller-supplied history.
 *
 * Accepts both {@code {"sender":"scammer","text":"..."}} and a bare string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnMessage {

    private String sender;
    private String text;

    /** ISO-8601, informational only */
    private String timestamp;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TurnMessage ofText(String text) {
        return TurnMessage.builder().sender(Sender.scammer.name()).text(text).build();
    }
}
