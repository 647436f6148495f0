package com.deepansh.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed view of the {@code honeypot.*} block in application.yml.
 * Registered via {@code @EnableConfigurationProperties} on the application class.
 */
@Data
@ConfigurationProperties(prefix = "honeypot")
public class HoneypotProperties {

    private Session session = new Session();
    private Scoring scoring = new Scoring();
    private Reporter reporter = new Reporter();
    private Security security = new Security();

    @Data
    public static class Session {
        /** Idle time after which the sweeper finalizes a session. */
        private long timeoutSeconds = 300;
        private long sweepIntervalMs = 60_000;
        private boolean sweeperEnabled = true;
        /** Number of flagged turns that confirms a session as a scam. */
        private int confirmThreshold = 2;
        private String defaultChannel = "SMS";
        private String defaultLanguage = "English";
        private String defaultLocale = "IN";
    }

    @Data
    public static class Scoring {
        /** A turn is flagged when its confidence is strictly above this. */
        private double flagConfidence = 0.3;
    }

    @Data
    public static class Reporter {
        private boolean enabled = false;
        private String url = "https://hackathon.guvi.in/api/updateHoneyPotFinalResult";
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 10_000;
    }

    @Data
    public static class Security {
        private String apiKey;
    }
}
