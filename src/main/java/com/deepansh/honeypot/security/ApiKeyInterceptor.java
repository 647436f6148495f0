package com.deepansh.honeypot.security;

import com.deepansh.honeypot.config.HoneypotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Map;

/**
 * Shared-secret check on the x-api-key header.
 *
 * If no key is configured every protected request is rejected; an
 * unconfigured deployment should not be an open one.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    public static final String HEADER = "x-api-key";

    private final HoneypotProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler)
            throws IOException {
        String expected = properties.getSecurity().getApiKey();
        String provided = req.getHeader(HEADER);

        if (expected == null || expected.isBlank()) {
            log.error("honeypot.security.api-key is not set, rejecting {} {}", req.getMethod(), req.getRequestURI());
            reject(res, "API key not configured");
            return false;
        }
        if (provided == null || !matches(expected, provided)) {
            log.warn("Rejected request with {} API key [{} {}]",
                    provided == null ? "missing" : "invalid", req.getMethod(), req.getRequestURI());
            reject(res, "Invalid API key");
            return false;
        }
        return true;
    }

    private boolean matches(String expected, String provided) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse res, String message) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(res.getWriter(), Map.of(
                "status", "error",
                "message", message,
                "timestamp", Instant.now().toString()));
    }
}
