package com.deepansh.honeypot.llm;

import com.deepansh.honeypot.exception.LlmClientException;
import com.deepansh.honeypot.model.LlmResponse;
import com.deepansh.honeypot.model.PromptMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible chat-completions client. Works with NVIDIA NIM,
 * OpenAI and Groq.
 *
 * Error handling strategy:
 *
 * | Error               | Action                                            |
 * |---------------------|---------------------------------------------------|
 * | 401                 | LlmClientException (not retried, not CB failure)  |
 * | 429                 | RuntimeException (retried, counts as failure)     |
 * | 400 / other 4xx     | LlmClientException (not retried, not CB failure)  |
 * | 5xx                 | RuntimeException (retried, counts as failure)     |
 * | network error       | ResourceAccessException (retried)                 |
 * | no choices returned | LlmClientException                                |
 */
@Slf4j
public class GenericLlmClient implements LlmClient {

    private final LlmProviderProperties props;
    private final String providerName;
    private final RestClient restClient;

    public GenericLlmClient(LlmProviderProperties props,
                            String providerName,
                            RestClient.Builder restClientBuilder) {
        this.props = props;
        this.providerName = providerName;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public LlmResponse chat(List<PromptMessage> messages, CompletionSettings settings) {
        Map<String, Object> requestBody = buildRequestBody(messages, settings);

        log.debug("Sending {} messages to {} [model={}]",
                messages.size(), providerName, props.getModel());

        Map<String, Object> response = restClient.post()
                .uri("/chat/completions")
                .body(requestBody)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                    handle4xxError(body, res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                    log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                    // 5xx is retryable, so plain RuntimeException rather than LlmClientException
                    throw new RuntimeException(
                            providerName + " server error [" + res.getStatusCode() + "]: " + body);
                })
                .body(new ParameterizedTypeReference<>() {});

        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new LlmClientException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new RuntimeException(providerName + " rate limit exceeded. Will retry.");
        }

        throw new LlmClientException(providerName + " client error [" + statusCode + "]: " + body);
    }

    Map<String, Object> buildRequestBody(List<PromptMessage> messages, CompletionSettings settings) {
        CompletionSettings s = settings != null ? settings : CompletionSettings.defaults();

        List<Map<String, Object>> formattedMessages = adaptRoles(messages).stream()
                .map(this::formatMessage)
                .toList();

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", s.maxTokens() != null ? s.maxTokens() : props.getMaxTokens());
        body.put("temperature", s.temperature() != null ? s.temperature() : props.getTemperature());
        if (s.topP() != null) {
            body.put("top_p", s.topP());
        }
        body.put("messages", formattedMessages);
        return body;
    }

    /**
     * For providers without system-role support, each system message
     * becomes a user instruction block followed by an assistant
     * acknowledgement, so the turn order stays user/assistant alternating.
     */
    private List<PromptMessage> adaptRoles(List<PromptMessage> messages) {
        if (props.isSystemRoleSupported()) {
            return messages;
        }
        List<PromptMessage> converted = new ArrayList<>(messages.size() + 2);
        for (PromptMessage m : messages) {
            if (m.getRole() == PromptMessage.Role.system) {
                converted.add(PromptMessage.user("[INSTRUCTIONS]\n" + m.getContent() + "\n[END INSTRUCTIONS]"));
                converted.add(PromptMessage.assistant("I understand. I will follow these instructions."));
            } else {
                converted.add(m);
            }
        }
        return converted;
    }

    private Map<String, Object> formatMessage(PromptMessage msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());
        m.put("content", msg.getContent() != null ? msg.getContent() : "");
        return m;
    }

    @SuppressWarnings("unchecked")
    private LlmResponse parseResponse(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null
                : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new LlmClientException(providerName + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            promptTokens     = ((Number) usage.getOrDefault("prompt_tokens", 0)).intValue();
            completionTokens = ((Number) usage.getOrDefault("completion_tokens", 0)).intValue();
            log.debug("Token usage [prompt={}, completion={}]", promptTokens, completionTokens);
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String content = message != null ? (String) message.get("content") : null;

        return LlmResponse.builder()
                .content(content != null ? content : "")
                .promptTokens(promptTokens)
                .completionTokens(completionTokens)
                .build();
    }
}
