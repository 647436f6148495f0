package com.deepansh.honeypot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversation context supplied by the caller on a turn.
 * Only consulted when a session is first opened; later values are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadata {

    /** SMS / WhatsApp / Email / Chat */
    private String channel;
    private String language;
    /** Country or region, e.g. IN */
    private String locale;
}
