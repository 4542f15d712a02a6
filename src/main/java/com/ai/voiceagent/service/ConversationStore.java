package com.ai.voiceagent.service;

import com.ai.voiceagent.conversation.ConversationTurn;

import java.util.List;

/**
 * Bounded conversation history keyed by session id. A session is either a web chat session or a
 * phone call (keyed by its CallSid).
 */
public interface ConversationStore {

    /** Appends a turn, evicting the oldest turns first when the session is at capacity. */
    void append(String sessionId, ConversationTurn turn);

    /** Snapshot of the session's turns, oldest first. Empty for unknown sessions. */
    List<ConversationTurn> getHistory(String sessionId);

    /** Forgets the session; a later append starts a new, empty history. */
    void reset(String sessionId);

    int getMaxTurns();

    default void appendUser(String sessionId, String text) {
        append(sessionId, ConversationTurn.user(text));
    }

    default void appendAssistant(String sessionId, String text) {
        append(sessionId, ConversationTurn.agent(text));
    }
}
