package com.ai.voiceagent.service;

import com.ai.voiceagent.component.ResponsePhrases;
import com.ai.voiceagent.conversation.IntentResult;
import com.ai.voiceagent.utils.ConversationIntent;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a classified intent into reply text. Intents with several templates go through the
 * {@link TemplateSelector}; everything else is fixed or computed.
 */
@Service
public class ResponseGenerator {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);

    private static final Pattern WHAT_PREFIX = Pattern.compile("^what(\\s+is|\\s+are|'s|\\s+was|\\s+were)?\\s*");
    private static final Pattern MADE_YOU = Pattern.compile("(made|created|built|programmed|designed) you");

    private final ResponsePhrases phrases;
    private final TemplateSelector selector;
    private final Clock clock;

    public ResponseGenerator(ResponsePhrases phrases, TemplateSelector selector, Clock clock) {
        this.phrases = phrases;
        this.selector = selector;
        this.clock = clock;
    }

    public String generate(IntentResult result, String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return ResponsePhrases.NO_INPUT;
        }
        return generate(result.getIntent(), utterance);
    }

    public String generate(ConversationIntent intent, String utterance) {
        if (StringUtils.isBlank(utterance)) {
            return ResponsePhrases.NO_INPUT;
        }
        String text = IntentClassifier.normalize(utterance);

        switch (intent) {
            case GREETING:
                return selector.choose(phrases.greetings());
            case IDENTITY:
                return phrases.identity();
            case TIME:
                return phrases.time(LocalDateTime.now(clock).format(TIME_FORMAT));
            case DATE:
                return phrases.date(LocalDateTime.now(clock).format(DATE_FORMAT));
            case WELLBEING:
                return selector.choose(phrases.wellbeing());
            case WEATHER:
                return phrases.weather();
            case JOKE:
                return selector.choose(phrases.jokes());
            case HELP:
                return phrases.help();
            case THANKS:
                return selector.choose(phrases.thanks());
            case FAREWELL:
                return phrases.farewell();
            case LIFE_MEANING:
                return phrases.lifeMeaning();
            case COMPLIMENT:
                return selector.choose(phrases.compliments());
            case QUESTION_WHAT:
                return answerWhat(text);
            case QUESTION_HOW:
                return answerHow(text);
            case QUESTION_WHY:
                return phrases.questionWhy();
            case QUESTION_WHEN:
                return phrases.questionWhen();
            case QUESTION_WHERE:
                return text.contains("you") ? phrases.questionWhereYou() : phrases.questionWhere();
            case QUESTION_WHO:
                return MADE_YOU.matcher(text).find() ? phrases.questionWhoMadeYou() : phrases.questionWho();
            case GENERIC_QUESTION:
                return selector.choose(phrases.genericQuestion());
            case FALLBACK:
            default:
                return selector.choose(phrases.fallback(IntentClassifier.firstToken(text)));
        }
    }

    private String answerWhat(String text) {
        if (text.contains("favorite") || text.contains("favourite")) {
            return phrases.questionWhatFavorite();
        }
        String topic = WHAT_PREFIX.matcher(text).replaceFirst("");
        topic = StringUtils.stripEnd(topic, "?!. ").trim();
        return phrases.questionWhat(topic.isEmpty() ? "that" : topic);
    }

    private String answerHow(String text) {
        if (text.startsWith("how old")) {
            return phrases.questionHowOld();
        }
        if (text.contains("work")) {
            return phrases.questionHowWorks();
        }
        return phrases.questionHow();
    }
}
