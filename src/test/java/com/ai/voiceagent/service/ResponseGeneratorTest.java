package com.ai.voiceagent.service;

import com.ai.voiceagent.component.RandomTemplateSelector;
import com.ai.voiceagent.component.ResponsePhrases;
import com.ai.voiceagent.utils.ConversationIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseGeneratorTest {

    private final ResponsePhrases phrases = new ResponsePhrases("Aria");
    private final IntentClassifier classifier = new IntentClassifier();
    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T14:05:00Z"), ZoneOffset.UTC);

    private ResponseGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new ResponseGenerator(phrases, variants -> variants.get(0), clock);
    }

    @Test
    void greetingIsOneOfTheGreetingTemplates() {
        ResponseGenerator random = new ResponseGenerator(phrases, new RandomTemplateSelector(), clock);

        for (int i = 0; i < 10; i++) {
            assertThat(random.generate(classifier.classify("hello"), "hello")).isIn(phrases.greetings());
        }
    }

    @Test
    void timeAndDateUseTheClock() {
        assertThat(reply("what time is it")).isEqualTo("It's currently 2:05 PM.");
        assertThat(reply("what is the date")).isEqualTo("Today is Friday, March 15, 2024.");
    }

    @Test
    void identityMentionsTheAgentName() {
        assertThat(reply("who are you")).contains("Aria");
    }

    @Test
    void fallbackEchoesTheFirstToken() {
        assertThat(reply("Bananas are yellow")).isEqualTo("Interesting! Tell me more about bananas.");
    }

    @Test
    void whatQuestionEchoesTheTopic() {
        assertThat(reply("what is python?")).isEqualTo(phrases.questionWhat("python"));
        assertThat(reply("what is your favorite color")).isEqualTo(phrases.questionWhatFavorite());
    }

    @Test
    void questionSubBranches() {
        assertThat(reply("how old are you")).isEqualTo(phrases.questionHowOld());
        assertThat(reply("how does this work")).isEqualTo(phrases.questionHowWorks());
        assertThat(reply("how do I bake bread")).isEqualTo(phrases.questionHow());
        assertThat(reply("where do you live")).isEqualTo(phrases.questionWhereYou());
        assertThat(reply("where is paris")).isEqualTo(phrases.questionWhere());
        assertThat(reply("who created you")).isEqualTo(phrases.questionWhoMadeYou());
        assertThat(reply("who is the president")).isEqualTo(phrases.questionWho());
    }

    @Test
    void blankUtteranceGetsTheNoInputReply() {
        assertThat(generator.generate(ConversationIntent.GREETING, "  ")).isEqualTo(ResponsePhrases.NO_INPUT);
        assertThat(generator.generate(classifier.classify(""), "")).isEqualTo(ResponsePhrases.NO_INPUT);
    }

    @Test
    void selectorPicksAmongVariants() {
        ResponseGenerator last = new ResponseGenerator(phrases, variants -> variants.get(variants.size() - 1), clock);

        assertThat(last.generate(ConversationIntent.JOKE, "tell me a joke")).isEqualTo(phrases.jokes().get(3));
        assertThat(generator.generate(ConversationIntent.JOKE, "tell me a joke")).isEqualTo(phrases.jokes().get(0));
    }

    private String reply(String utterance) {
        return generator.generate(classifier.classify(utterance), utterance);
    }
}
