package com.deepansh.honeypot.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-based idempotency for inbound chat turns.
 *
 * The calling platform retries on timeouts. Without a key, a retried turn
 * is appended twice and, if flagged, counts twice toward confirmation.
 * With an Idempotency-Key header the first response is cached and replayed.
 *
 * Key pattern: honeypot:idempotency:{idempotencyKey}
 * TTL: 24 hours
 *
 * Any Redis failure is logged and the turn is processed normally.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "honeypot:idempotency:";
    private static final Duration TTL = Duration.ofHours(24);
    // Stored while the first request is still being handled
    private static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;

    public IdempotencyService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Optional.empty() → key is new (or in flight, or Redis is down), proceed.
     * Optional.of(json) → replay this response.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing;
        try {
            existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
        } catch (DataAccessException e) {
            log.warn("Idempotency lookup failed, processing normally [key={}]: {}", idempotencyKey, e.getMessage());
            return Optional.empty();
        }

        if (existing == null) {
            return Optional.empty();
        }
        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight, proceeding anyway", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /** SET NX. Returns true if this caller now owns the key. */
    public boolean claimKey(String idempotencyKey) {
        try {
            Boolean claimed = redisTemplate.opsForValue()
                    .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, TTL);
            return Boolean.TRUE.equals(claimed);
        } catch (DataAccessException e) {
            log.warn("Idempotency claim failed, processing normally [key={}]: {}", idempotencyKey, e.getMessage());
            return true;
        }
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        try {
            redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, TTL);
            log.debug("Stored idempotency response for key={}", idempotencyKey);
        } catch (DataAccessException e) {
            log.warn("Could not cache response [key={}]: {}", idempotencyKey, e.getMessage());
        }
    }

    /** Called when the turn failed so the client's retry is processed. */
    public void releaseKey(String idempotencyKey) {
        try {
            redisTemplate.delete(buildKey(idempotencyKey));
            log.debug("Released idempotency key={}", idempotencyKey);
        } catch (DataAccessException e) {
            log.warn("Could not release idempotency key={}: {}", idempotencyKey, e.getMessage());
        }
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
