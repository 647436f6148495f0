package com.deepansh.honeypot.model;

/**
 * Flag counter and confirmation for one session.
 * Unknown sessions report {@link #none()}; do not use this to test existence.
 */
public record ScamStatus(int scamFlags, boolean confirmedScam) {

    private static final ScamStatus NONE = new ScamStatus(0, false);

    public static ScamStatus none() {
        return NONE;
    }
}
