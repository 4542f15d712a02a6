package com.ai.voiceagent.service;

import com.ai.voiceagent.component.ResponsePhrases;
import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.conversation.IntentResult;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces the agent's reply for one utterance. The remote completion backend is tried first; if
 * it is unavailable, slow or failing, the rule-based classifier and generator answer instead. This
 * method never throws.
 */
@Service
public class CompletionFallbackService {

    private static final Logger log = LoggerFactory.getLogger(CompletionFallbackService.class);

    private final CompletionClient completionClient;
    private final ConversationStore conversationStore;
    private final IntentClassifier intentClassifier;
    private final ResponseGenerator responseGenerator;
    private final Executor executor;
    private final Duration completionTimeout;
    private final String systemPreamble;

    public CompletionFallbackService(CompletionClient completionClient,
                                     ConversationStore conversationStore,
                                     IntentClassifier intentClassifier,
                                     ResponseGenerator responseGenerator,
                                     @Qualifier("agentTaskExecutor") Executor executor,
                                     @Value("${agent.completion.timeout:15s}") Duration completionTimeout,
                                     ResponsePhrases phrases) {
        this.completionClient = completionClient;
        this.conversationStore = conversationStore;
        this.intentClassifier = intentClassifier;
        this.responseGenerator = responseGenerator;
        this.executor = executor;
        this.completionTimeout = completionTimeout;
        this.systemPreamble = "You are " + phrases.getAgentName() + ", a helpful voice assistant. "
                + "Be concise and friendly. Keep responses short (1-2 sentences) for voice calls. "
                + "Don't use markdown or special formatting.";
    }

    public String respond(String sessionId, String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return ResponsePhrases.NO_INPUT;
        }

        if (completionClient.isAvailable()) {
            String reply = tryCompletion(sessionId, utterance);
            if (reply != null) {
                return reply;
            }
        }

        try {
            IntentResult intent = intentClassifier.classify(utterance);
            log.debug("[{}] rule-based reply for {}", sessionId, intent);
            return responseGenerator.generate(intent, utterance);
        } catch (RuntimeException ex) {
            log.error("[{}] Rule-based reply failed", sessionId, ex);
            return ResponsePhrases.CONNECTION_TROUBLE;
        }
    }

    public String getSystemPreamble() {
        return systemPreamble;
    }

    /**
     * @return the completion reply, or null when the caller should fall back
     */
    private String tryCompletion(String sessionId, String utterance) {
        conversationStore.appendUser(sessionId, utterance);
        List<ConversationTurn> history = conversationStore.getHistory(sessionId);

        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(() -> completionClient.complete(systemPreamble, history), executor);
        } catch (RuntimeException ex) {
            log.warn("[{}] Completion task rejected: {}", sessionId, ex.getMessage());
            return null;
        }

        try {
            String reply = future.get(completionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (StringUtils.isBlank(reply)) {
                log.warn("[{}] Completion returned an empty reply; using fallback", sessionId);
                return null;
            }
            String trimmed = reply.trim();
            conversationStore.appendAssistant(sessionId, trimmed);
            return trimmed;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("[{}] Completion timed out after {} ms; using fallback", sessionId, completionTimeout.toMillis());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("[{}] Completion failed; using fallback: {}", sessionId, cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for completion; using fallback", sessionId);
        }
        return null;
    }
}
