package com.ai.voiceagent.component;

import com.ai.voiceagent.conversation.ConversationTurn;
import com.ai.voiceagent.utils.TurnRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryConversationStoreTest {

    private final InMemoryConversationStore store = new InMemoryConversationStore(10);

    @Test
    void keepsOnlyTheMostRecentTurnsInOrder() {
        for (int i = 1; i <= 14; i++) {
            store.appendUser("s1", "message " + i);
        }

        List<ConversationTurn> history = store.getHistory("s1");

        assertThat(history).hasSize(store.getMaxTurns());
        assertThat(history).extracting(ConversationTurn::getContent).containsExactly(
                "message 5", "message 6", "message 7", "message 8", "message 9",
                "message 10", "message 11", "message 12", "message 13", "message 14");
    }

    @Test
    void returnsTurnsWithTheirRoles() {
        store.appendUser("s1", "hello");
        store.appendAssistant("s1", "Hi there!");

        assertThat(store.getHistory("s1")).containsExactly(
                new ConversationTurn(TurnRole.USER, "hello"),
                new ConversationTurn(TurnRole.AGENT, "Hi there!"));
    }

    @Test
    void sessionsAreIsolated() {
        store.appendUser("a", "from a");
        store.appendUser("b", "from b");

        store.reset("a");

        assertThat(store.getHistory("a")).isEmpty();
        assertThat(store.getHistory("b")).extracting(ConversationTurn::getContent).containsExactly("from b");
    }

    @Test
    void resetForgetsTheSession() {
        store.appendUser("a", "hello");
        store.appendUser("b", "hello");

        store.reset("a");

        assertThat(store.getSessionCount()).isEqualTo(1);
        store.appendUser("a", "again");
        assertThat(store.getHistory("a")).extracting(ConversationTurn::getContent).containsExactly("again");
    }

    @Test
    void unknownSessionHasEmptyHistory() {
        assertThat(store.getHistory("nobody")).isEmpty();
        store.reset("nobody");
        assertThat(store.getHistory("nobody")).isEmpty();
    }

    @Test
    void historyIsASnapshot() {
        store.appendUser("s1", "one");
        List<ConversationTurn> snapshot = store.getHistory("s1");

        store.appendUser("s1", "two");

        assertThat(snapshot).hasSize(1);
        assertThatThrownBy(() -> snapshot.add(ConversationTurn.user("x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new InMemoryConversationStore(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentAppendsNeverExceedCapacity() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        store.appendUser("shared", thread + ":" + i);
                        assertThat(store.getHistory("shared").size()).isLessThanOrEqualTo(10);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.getHistory("shared")).hasSize(10);
    }
}
