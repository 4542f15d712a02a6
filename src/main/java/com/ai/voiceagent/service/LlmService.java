package com.ai.voiceagent.service;

import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.exception.CompletionBackendException;
import com.ai.voiceagent.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates replies through an OpenAI-compatible Chat Completions endpoint (Groq by default).
 */
@Service
public class LlmService implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final RestTemplateBuilder builder;
    private final ObjectMapper mapper = new ObjectMapper();

    private RestTemplate restTemplate;
    private volatile boolean available;

    @Value("${completion.api-key:${GROQ_API_KEY:}}")
    private String apiKey;

    @Value("${completion.base-url:https://api.groq.com/openai/v1}")
    private String baseUrl;

    @Value("${completion.model:llama-3.3-70b-versatile}")
    private String model;

    @Value("${completion.temperature:0.7}")
    private double temperature;

    @Value("${completion.max-tokens:150}")
    private int maxTokens;

    @Value("${completion.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${completion.read-timeout:15s}")
    private Duration readTimeout;

    public LlmService(RestTemplateBuilder builder) {
        this.builder = builder;
    }

    @PostConstruct
    void init() {
        this.restTemplate = builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
        initialize();
    }

    /**
     * Evaluates whether the backend can be used. Runs once at startup; calling it again is the only
     * way the availability flag changes.
     */
    public boolean initialize() {
        if (StringUtils.isBlank(apiKey)) {
            log.warn("Completion API key is not set; replies will use the rule-based fallback");
            available = false;
        } else {
            log.info("Completion backend initialized | model={} url={}", model, baseUrl);
            available = true;
        }
        return available;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public String complete(String systemPreamble, List<ConversationTurn> history) {
        if (!available) {
            throw CompletionBackendException.unavailable();
        }

        String url = StringUtils.removeEnd(baseUrl.trim(), "/") + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey.trim());
        headers.setContentType(MediaType.APPLICATION_JSON);

        List<Map<String, String>> messages = new ArrayList<>();
        Map<String, String> systemMsg = new HashMap<>();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPreamble);
        messages.add(systemMsg);

        for (ConversationTurn turn : history) {
            Map<String, String> m = new HashMap<>();
            m.put("role", turn.getRole().getApiRole());
            m.put("content", turn.getContent());
            messages.add(m);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.put("messages", messages);

        String reply;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
            JsonNode root = mapper.readTree(response.getBody());
            reply = root.path("choices").path(0).path("message").path("content").asText("").trim();
        } catch (RestClientException ex) {
            throw new CompletionBackendException("Completion request failed", ex);
        } catch (Exception ex) {
            throw new CompletionBackendException("Malformed completion response", ex);
        }

        if (reply.isEmpty()) {
            throw new CompletionBackendException(ErrorCode.COMPLETION_BACKEND_ERROR, "Completion response had no content");
        }
        log.debug("Completion reply: {}", reply);
        return reply;
    }
}
