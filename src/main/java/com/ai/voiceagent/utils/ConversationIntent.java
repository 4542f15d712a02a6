package com.ai.voiceagent.utils;

/**
 * Closed set of intents the rule-based classifier can assign to an utterance.
 * Exactly one is selected per utterance.
 */
public enum ConversationIntent {
    GREETING,
    IDENTITY,
    TIME,
    DATE,
    WELLBEING,
    WEATHER,
    JOKE,
    HELP,
    THANKS,
    FAREWELL,
    LIFE_MEANING,
    COMPLIMENT,
    QUESTION_WHAT,
    QUESTION_HOW,
    QUESTION_WHY,
    QUESTION_WHEN,
    QUESTION_WHERE,
    QUESTION_WHO,
    GENERIC_QUESTION,
    FALLBACK
}
