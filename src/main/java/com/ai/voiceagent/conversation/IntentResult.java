package com.ai.voiceagent.conversation;

import com.ai.voiceagent.utils.ConversationIntent;

/**
 * Result of classifying one utterance: the selected intent plus the slots extracted on the way.
 */
public final class IntentResult {

    private final ConversationIntent intent;
    private final String keyword;
    private final String firstToken;

    public IntentResult(ConversationIntent intent, String keyword, String firstToken) {
        this.intent = intent != null ? intent : ConversationIntent.FALLBACK;
        this.keyword = keyword;
        this.firstToken = firstToken != null ? firstToken : "";
    }

    public ConversationIntent getIntent() {
        return intent;
    }

    /** Keyword or phrase that triggered the rule, or null for the prefix, question-mark and fallback rules. */
    public String getKeyword() {
        return keyword;
    }

    public String getFirstToken() {
        return firstToken;
    }

    public static IntentResult fallback(String firstToken) {
        return new IntentResult(ConversationIntent.FALLBACK, null, firstToken);
    }

    @Override
    public String toString() {
        return "IntentResult{intent=" + intent + ", keyword=" + keyword + ", firstToken=" + firstToken + "}";
    }
}
