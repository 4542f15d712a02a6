package com.ai.voiceagent.service;

import com.ai.voiceagent.conversation.IntentResult;
import com.ai.voiceagent.utils.ConversationIntent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based single-intent classifier. Rules are evaluated in table order and the first match wins,
 * so overlapping categories resolve the same way every time ("what is the weather" is WEATHER, not
 * QUESTION_WHAT; "how are you" is WELLBEING, not QUESTION_HOW).
 */
@Service
public class IntentClassifier {

    private static final Pattern GREETING = Pattern.compile("\\b(hello|hi|hey|greetings|sup)\\b");

    private static final Pattern IDENTITY = Pattern.compile("(who are you|your name|what are you)");

    private static final Pattern DATE = Pattern.compile("(date|today|what day)");

    private static final Pattern WELLBEING = Pattern.compile("(how are you|how do you feel)");

    private static final Pattern WEATHER = Pattern.compile("(weather|temperature)");

    private static final Pattern JOKE = Pattern.compile("(joke|funny|make me laugh)");

    private static final Pattern HELP = Pattern.compile("(help|what can you do|capabilities)");

    private static final Pattern THANKS = Pattern.compile("(thank|\\bthx\\b|\\bty\\b|appreciate)");

    private static final Pattern FAREWELL = Pattern.compile("\\b(goodbye|bye|quit|exit|see you|farewell)\\b");

    private static final Pattern COMPLIMENT = Pattern.compile(
            "\\b(great|awesome|amazing|smart|clever|brilliant|cool|wonderful|fantastic|nice|impressive|excellent|good job|well done)\\b"
    );

    private static final Pattern QUESTION_PREFIX = Pattern.compile("^(what|how|why|when|where|who)\\b");

    private static final List<IntentRule> RULES = List.of(
            IntentRule.pattern(ConversationIntent.GREETING, GREETING),
            IntentRule.pattern(ConversationIntent.IDENTITY, IDENTITY),
            IntentRule.of(ConversationIntent.TIME, IntentClassifier::matchTime),
            IntentRule.pattern(ConversationIntent.DATE, DATE),
            IntentRule.pattern(ConversationIntent.WELLBEING, WELLBEING),
            IntentRule.pattern(ConversationIntent.WEATHER, WEATHER),
            IntentRule.pattern(ConversationIntent.JOKE, JOKE),
            IntentRule.pattern(ConversationIntent.HELP, HELP),
            IntentRule.pattern(ConversationIntent.THANKS, THANKS),
            IntentRule.pattern(ConversationIntent.FAREWELL, FAREWELL),
            IntentRule.of(ConversationIntent.LIFE_MEANING, IntentClassifier::matchLifeMeaning),
            IntentRule.pattern(ConversationIntent.COMPLIMENT, COMPLIMENT)
    );

    /**
     * Classify one utterance. Never throws; blank input comes back as FALLBACK with an empty token.
     */
    public IntentResult classify(String utterance) {
        String text = normalize(utterance);
        String firstToken = firstToken(text);
        if (text.isEmpty()) {
            return IntentResult.fallback(firstToken);
        }

        for (IntentRule rule : RULES) {
            String keyword = rule.match(text);
            if (keyword != null) {
                return new IntentResult(rule.intent, keyword, firstToken);
            }
        }

        Matcher prefix = QUESTION_PREFIX.matcher(text);
        if (prefix.find()) {
            return new IntentResult(questionIntent(prefix.group(1)), prefix.group(1), firstToken);
        }

        if (text.endsWith("?")) {
            return new IntentResult(ConversationIntent.GENERIC_QUESTION, null, firstToken);
        }
        return IntentResult.fallback(firstToken);
    }

    public ConversationIntent classifyIntent(String utterance) {
        return classify(utterance).getIntent();
    }

    static String normalize(String utterance) {
        return utterance == null ? "" : utterance.trim().toLowerCase(Locale.ROOT);
    }

    static String firstToken(String normalized) {
        if (StringUtils.isBlank(normalized)) {
            return "";
        }
        return normalized.trim().split("\\s+", 2)[0];
    }

    /** "sometimes" contains "time" but is not a question about the clock. */
    private static String matchTime(String text) {
        return text.contains("time") && !text.contains("sometimes") ? "time" : null;
    }

    private static String matchLifeMeaning(String text) {
        if (text.contains("meaning of life")) {
            return "meaning of life";
        }
        return text.contains("life") && text.contains("meaning") ? "meaning" : null;
    }

    private static ConversationIntent questionIntent(String prefix) {
        switch (prefix) {
            case "what": return ConversationIntent.QUESTION_WHAT;
            case "how": return ConversationIntent.QUESTION_HOW;
            case "why": return ConversationIntent.QUESTION_WHY;
            case "when": return ConversationIntent.QUESTION_WHEN;
            case "where": return ConversationIntent.QUESTION_WHERE;
            default: return ConversationIntent.QUESTION_WHO;
        }
    }

    @FunctionalInterface
    private interface KeywordMatcher {
        /** Returns the matched keyword, or null when the rule does not apply. */
        String match(String normalizedText);
    }

    private static final class IntentRule {

        private final ConversationIntent intent;
        private final KeywordMatcher matcher;

        private IntentRule(ConversationIntent intent, KeywordMatcher matcher) {
            this.intent = intent;
            this.matcher = matcher;
        }

        static IntentRule of(ConversationIntent intent, KeywordMatcher matcher) {
            return new IntentRule(intent, matcher);
        }

        static IntentRule pattern(ConversationIntent intent, Pattern pattern) {
            return new IntentRule(intent, text -> {
                Matcher m = pattern.matcher(text);
                return m.find() ? m.group().trim() : null;
            });
        }

        String match(String text) {
            return matcher.match(text);
        }
    }
}
