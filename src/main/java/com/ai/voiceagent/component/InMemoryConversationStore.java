package com.ai.voiceagent.component;

import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.service.ConversationStore;
import com.ai.voiceagent.utils.TurnRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local history. Appends and resets go through the map's per-key {@code compute}, so they
 * are serialized per session while different sessions proceed independently. Readers lock the
 * deque itself. Nothing survives a restart.
 */
@Component
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    private final Map<String, Deque<ConversationTurn>> conversations = new ConcurrentHashMap<>();
    private final int maxTurns;

    public InMemoryConversationStore(@Value("${agent.history.max-turns:10}") int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("agent.history.max-turns must be at least 1");
        }
        this.maxTurns = maxTurns;
    }

    @Override
    public void append(String sessionId, ConversationTurn turn) {
        if (sessionId == null || turn == null) return;
        conversations.compute(sessionId, (key, existing) -> {
            Deque<ConversationTurn> history = existing != null ? existing : new ArrayDeque<>();
            synchronized (history) {
                while (history.size() >= maxTurns) {
                    history.pollFirst();
                }
                history.addLast(turn);
            }
            return history;
        });
        log.info("[{}] {}: {}", sessionId, turn.getRole() == TurnRole.USER ? "User" : "Assistant", turn.getContent());
    }

    @Override
    public List<ConversationTurn> getHistory(String sessionId) {
        if (sessionId == null) return Collections.emptyList();
        Deque<ConversationTurn> history = conversations.get(sessionId);
        if (history == null) return Collections.emptyList();
        synchronized (history) {
            return Collections.unmodifiableList(new ArrayList<>(history));
        }
    }

    @Override
    public void reset(String sessionId) {
        if (sessionId == null) return;
        conversations.computeIfPresent(sessionId, (key, history) -> {
            synchronized (history) {
                history.clear();
            }
            return null;
        });
        log.info("[{}] Conversation reset", sessionId);
    }

    public int getSessionCount() {
        return conversations.size();
    }

    @Override
    public int getMaxTurns() {
        return maxTurns;
    }
}
