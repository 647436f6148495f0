package com.deepansh.honeypot.model;

/**
 * Who wrote a turn. {@code user} is the honeypot persona speaking back.
 * Lower-case constants so the stored and wire form is the plain label.
 */
public enum Sender {
    scammer, user;

    /** Unknown or missing labels are treated as the counterpart. */
    public static Sender fromLabel(String label) {
        if (label == null) return scammer;
        return "user".equalsIgnoreCase(label.trim()) ? user : scammer;
    }
}
