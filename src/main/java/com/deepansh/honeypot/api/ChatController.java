package com.deepansh.honeypot.api;

import com.deepansh.honeypot.core.ConversationService;
import com.deepansh.honeypot.core.TurnResult;
import com.deepansh.honeypot.exception.TurnInProgressException;
import com.deepansh.honeypot.model.ChatRequest;
import com.deepansh.honeypot.model.ChatResponse;
import com.deepansh.honeypot.resilience.IdempotencyService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Turn ingestion.
 *
 * POST /api/chat
 *   Optional header: Idempotency-Key: <uuid>
 *   If provided, a repeated request within 24h gets the cached reply
 *   and is not appended to the session a second time. A repeat that
 *   arrives while the first is still being handled gets 409.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationService conversationService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(
            @RequestBody(required = false) ChatRequest body,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {

        ChatRequest request = body != null ? body : new ChatRequest();
        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();

        log.info("Chat request [sessionId={}, idempotencyKey={}]", request.getSessionId(), idempotencyKey);

        if (idempotent) {
            Optional<ChatResponse> cached = cachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claimKey(idempotencyKey)) {
                throw new TurnInProgressException(idempotencyKey);
            }
        }

        ChatResponse response;
        try {
            TurnResult result = conversationService.handleTurn(request);
            response = ChatResponse.success(result.sessionId(), result.reply());
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.releaseKey(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            cacheResponse(idempotencyKey, response);
        }
        return ResponseEntity.ok(response);
    }

    private Optional<ChatResponse> cachedResponse(String idempotencyKey) {
        Optional<String> cached = idempotencyService.getCachedResponse(idempotencyKey);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            log.info("Returning cached response for idempotency key={}", idempotencyKey);
            return Optional.of(objectMapper.readValue(cached.get(), ChatResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cached response, proceeding fresh [key={}]", idempotencyKey, e);
            return Optional.empty();
        }
    }

    private void cacheResponse(String idempotencyKey, ChatResponse response) {
        try {
            idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
        } catch (JsonProcessingException e) {
            log.warn("Failed to cache idempotency response [key={}]", idempotencyKey, e);
        }
    }
}
