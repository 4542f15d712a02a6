package com.ai.voiceagent.service;

import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.exception.CompletionBackendException;

import java.util.List;

/**
 * Remote chat-completion backend.
 */
public interface CompletionClient {

    /**
     * Whether the backend initialized successfully. Decided at startup; only an explicit
     * re-initialization changes it.
     */
    boolean isAvailable();

    /**
     * @throws CompletionBackendException when the backend is unavailable, errors or returns nothing usable
     */
    String complete(String systemPreamble, List<ConversationTurn> history);
}
