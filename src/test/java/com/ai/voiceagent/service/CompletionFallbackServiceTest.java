package com.ai.voiceagent.service;

import com.ai.voiceagent.component.InMemoryConversationStore;
import com.ai.voiceagent.component.ResponsePhrases;
import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.exception.CompletionBackendException;
import com.ai.voiceagent.utils.TurnRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompletionFallbackServiceTest {

    @Mock
    private CompletionClient completionClient;

    private final ResponsePhrases phrases = new ResponsePhrases("Aria");

    private InMemoryConversationStore store;
    private CompletionFallbackService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore(10);
        service = newService(Runnable::run, Duration.ofSeconds(15));
    }

    @Test
    void unavailableBackendUsesTheRuleBasedReply() {
        when(completionClient.isAvailable()).thenReturn(false);

        String reply = service.respond("default", "hello");

        assertThat(reply).isIn(phrases.greetings());
        verify(completionClient, never()).complete(anyString(), anyList());
        assertThat(store.getHistory("default")).isEmpty();
    }

    @Test
    void completionReplyIsRecordedWithTheUserTurn() {
        when(completionClient.isAvailable()).thenReturn(true);
        when(completionClient.complete(anyString(), anyList())).thenReturn("  Paris is the capital of France.  ");

        String reply = service.respond("web-1", "What is the capital of France?");

        assertThat(reply).isEqualTo("Paris is the capital of France.");
        assertThat(store.getHistory("web-1")).containsExactly(
                new ConversationTurn(TurnRole.USER, "What is the capital of France?"),
                new ConversationTurn(TurnRole.AGENT, "Paris is the capital of France."));
    }

    @Test
    @SuppressWarnings("unchecked")
    void completionSeesThePreambleAndPriorTurns() {
        when(completionClient.isAvailable()).thenReturn(true);
        when(completionClient.complete(anyString(), anyList())).thenReturn("first", "second");

        service.respond("web-1", "one");
        service.respond("web-1", "two");

        ArgumentCaptor<List<ConversationTurn>> history = ArgumentCaptor.forClass(List.class);
        verify(completionClient, times(2)).complete(eq(service.getSystemPreamble()), history.capture());
        assertThat(history.getAllValues().get(1))
                .extracting(ConversationTurn::getContent)
                .containsExactly("one", "first", "two");
        assertThat(service.getSystemPreamble()).startsWith("You are Aria");
    }

    @Test
    void backendErrorFallsBackToRules() {
        when(completionClient.isAvailable()).thenReturn(true);
        when(completionClient.complete(anyString(), anyList()))
                .thenThrow(new CompletionBackendException("Completion request failed", new RuntimeException("503")));

        assertThat(service.respond("s", "tell me a joke")).isEqualTo(phrases.jokes().get(0));
    }

    @Test
    void emptyCompletionFallsBackToRules() {
        when(completionClient.isAvailable()).thenReturn(true);
        when(completionClient.complete(anyString(), anyList())).thenReturn("   ");

        assertThat(service.respond("s", "thanks")).isEqualTo(phrases.thanks().get(0));
        assertThat(store.getHistory("s")).extracting(ConversationTurn::getRole).containsExactly(TurnRole.USER);
    }

    @Test
    void slowCompletionTimesOutAndFallsBack() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            CompletionFallbackService timed = newService(pool, Duration.ofMillis(100));
            when(completionClient.isAvailable()).thenReturn(true);
            when(completionClient.complete(anyString(), anyList())).thenAnswer(inv -> {
                release.await();
                return "too late";
            });

            assertThat(timed.respond("s", "hello")).isIn(phrases.greetings());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void blankInputGetsTheCannedReply() {
        assertThat(service.respond("s", "   ")).isEqualTo(ResponsePhrases.NO_INPUT);
        assertThat(service.respond("s", null)).isEqualTo(ResponsePhrases.NO_INPUT);
        verify(completionClient, never()).isAvailable();
    }

    @Test
    void generatorFailureGivesTheConnectionTroubleReply() {
        ResponseGenerator broken = new ResponseGenerator(phrases, variants -> {
            throw new IllegalStateException("boom");
        }, Clock.systemUTC());
        CompletionFallbackService failing = new CompletionFallbackService(completionClient, store,
                new IntentClassifier(), broken, Runnable::run, Duration.ofSeconds(1), phrases);
        when(completionClient.isAvailable()).thenReturn(false);

        assertThat(failing.respond("s", "hello")).isEqualTo(ResponsePhrases.CONNECTION_TROUBLE);
    }

    private CompletionFallbackService newService(Executor executor, Duration timeout) {
        ResponseGenerator generator = new ResponseGenerator(phrases, variants -> variants.get(0), Clock.systemUTC());
        return new CompletionFallbackService(completionClient, store, new IntentClassifier(), generator,
                executor, timeout, phrases);
    }
}
