package com.deepansh.honeypot.llm;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips the wrapper text chat models put around an in-character reply:
 * "Sure, here's Amit's reply:", markdown emphasis, surrounding quotes.
 * The persona must read as a person typing, not a bot quoting itself.
 */
@Component
public class ReplySanitizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    // Applied in order; an earlier match can expose a later prefix
    private static final List<Pattern> BOT_PREFIXES = List.of(
            Pattern.compile("^sure[,!.]?\\s*(here\\s*(is|are))?\\s*(the\\s*)?(my\\s*)?(your\\s*)?(amit'?s?\\s*)?(reply|response|message):?\\s*", FLAGS),
            Pattern.compile("^here'?s?\\s*(is|are)?\\s*(the\\s*)?(my\\s*)?(your\\s*)?(amit'?s?\\s*)?(reply|response|message):?\\s*", FLAGS),
            Pattern.compile("^(amit|amit sharma)\\s*(says?|replies?|responds?|would say|would respond):?\\s*", FLAGS),
            Pattern.compile("^(as amit|playing as amit|i would say|i would respond)[,:]?\\s*", FLAGS),
            Pattern.compile("^(my response|the response|response|your response):?\\s*", FLAGS),
            Pattern.compile("^(my reply|the reply|reply|your reply):?\\s*", FLAGS),
            Pattern.compile("^(answer|output):?\\s*", FLAGS),
            Pattern.compile("^\\*\\*amit\\*\\*:?\\s*", FLAGS),
            Pattern.compile("^amit:\\s*", FLAGS),
            Pattern.compile("^me:\\s*", FLAGS),
            Pattern.compile("^agent:\\s*", FLAGS),
            Pattern.compile("^user:\\s*", FLAGS),
            Pattern.compile("^assistant:\\s*", FLAGS),
            Pattern.compile("^sure[,!.]?\\s*", FLAGS),
            Pattern.compile("^in\\s+\\d+-?\\d*\\s*words?:?\\s*", FLAGS),
            Pattern.compile("^(here is|here's)\\s*(what)?\\s*(amit|i)\\s*(would|might|could)?\\s*(say|respond|reply):?\\s*", FLAGS),
            Pattern.compile("^okay[,.]?\\s*(here'?s?\\s*)?(is\\s*)?(my\\s*)?(reply|response):?\\s*", FLAGS),
            Pattern.compile("^(here'?s?\\s+my\\s+reply):?\\s*", FLAGS)
    );

    private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*(.+?)\\*\\*");
    private static final Pattern ITALIC_STAR = Pattern.compile("\\*(.+?)\\*");
    private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__(.+?)__");
    private static final Pattern ITALIC_UNDERSCORE = Pattern.compile("_(.+?)_");
    private static final Pattern CODE = Pattern.compile("`(.+?)`");
    private static final Pattern WRAPPING_QUOTES = Pattern.compile("^[\"']+|[\"']+$");

    /** @return cleaned single-line reply; empty if nothing survives */
    public String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String reply = raw.strip()
                .replace("\\\"", "\"")
                .replace("\\n", " ");

        for (Pattern prefix : BOT_PREFIXES) {
            reply = prefix.matcher(reply).replaceFirst("");
        }

        reply = BOLD_STARS.matcher(reply).replaceAll("$1");
        reply = ITALIC_STAR.matcher(reply).replaceAll("$1");
        reply = BOLD_UNDERSCORES.matcher(reply).replaceAll("$1");
        reply = ITALIC_UNDERSCORE.matcher(reply).replaceAll("$1");
        reply = CODE.matcher(reply).replaceAll("$1");

        reply = WRAPPING_QUOTES.matcher(reply.strip()).replaceAll("").strip();
        return String.join(" ", reply.split("\\s+")).strip();
    }
}
