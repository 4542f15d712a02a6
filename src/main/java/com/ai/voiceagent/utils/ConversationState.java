package com.ai.voiceagent.utils;

/**
 * State machine for a single phone call.
 */
public enum ConversationState {
    GREETING,
    GATHERING,
    ENDED
}
