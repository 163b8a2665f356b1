package com.phillippitts.hugdimon.service.session;

import com.phillippitts.hugdimon.config.properties.SessionProperties;
import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.domain.Turn;
import com.phillippitts.hugdimon.exception.SessionBusyException;
import com.phillippitts.hugdimon.exception.SessionNotFoundException;
import com.phillippitts.hugdimon.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class InMemorySessionStoreTest {

    private SessionProperties props;
    private MutableClock clock;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        props = new SessionProperties();
        props.setTtl(Duration.ofMinutes(30));
        props.setLockTimeout(Duration.ofSeconds(5));
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        store = new InMemorySessionStore(props, clock, "Greeting", "en");
    }

    @Test
    void createsNewConversationWhenIdMissing() {
        SessionState state = store.getOrCreate(null);

        assertThat(state.getConversationId()).isNotBlank();
        assertThat(state.getCurrentStepId()).isEqualTo("Greeting");
        assertThat(state.getLanguage()).isEqualTo("en");
        assertThat(state.getHistory()).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void returnsExistingConversationForKnownId() {
        String id = store.getOrCreate(null).getConversationId();

        assertThat(store.getOrCreate(id).getConversationId()).isEqualTo(id);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void createsUnderClientIdWhenImplicitCreateAllowed() {
        SessionState state = store.getOrCreate("client-chosen");

        assertThat(state.getConversationId()).isEqualTo("client-chosen");
    }

    @Test
    void rejectsUnknownIdWhenImplicitCreateDisabled() {
        props.setAllowImplicitCreate(false);

        assertThatThrownBy(() -> store.getOrCreate("nope"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void withLockCommitsWorkingCopyOnSuccess() {
        String id = store.getOrCreate(null).getConversationId();

        store.withLock(id, s -> {
            s.appendTurn(Turn.user("hi", clock.instant()));
            s.putSlot("party_size", "2");
            return null;
        });

        SessionState committed = store.find(id).orElseThrow();
        assertThat(committed.getHistory()).hasSize(1);
        assertThat(committed.getSlots()).containsEntry("party_size", "2");
    }

    @Test
    void withLockDiscardsChangesWhenFunctionThrows() {
        String id = store.getOrCreate(null).getConversationId();

        assertThatThrownBy(() -> store.withLock(id, s -> {
            s.appendTurn(Turn.user("hi", clock.instant()));
            s.setCurrentStepId("Confirm");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        SessionState committed = store.find(id).orElseThrow();
        assertThat(committed.getHistory()).isEmpty();
        assertThat(committed.getCurrentStepId()).isEqualTo("Greeting");
        // lock was released
        assertThat(store.<String>withLock(id, s -> "ok")).isEqualTo("ok");
    }

    @Test
    void snapshotsAreIndependentOfCommittedState() {
        String id = store.getOrCreate(null).getConversationId();
        SessionState snapshot = store.find(id).orElseThrow();

        snapshot.appendTurn(Turn.user("not committed", clock.instant()));

        assertThat(store.find(id).orElseThrow().getHistory()).isEmpty();
    }

    @Test
    void withLockOnUnknownIdThrowsNotFound() {
        assertThatThrownBy(() -> store.withLock("missing", s -> null))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void throwsBusyWhenLockNotGrantedInTime() throws Exception {
        props.setLockTimeout(Duration.ofMillis(100));
        String id = store.getOrCreate(null).getConversationId();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> store.withLock(id, s -> {
            holding.countDown();
            awaitLatch(release);
            return null;
        }));
        holder.start();
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        try {
            assertThatThrownBy(() -> store.withLock(id, s -> null))
                    .isInstanceOf(SessionBusyException.class);
        } finally {
            release.countDown();
            holder.join(2000);
        }
    }

    @Test
    void appliesConcurrentTurnsInLockGrantOrder() throws Exception {
        String id = store.getOrCreate(null).getConversationId();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> store.withLock(id, s -> {
            holding.countDown();
            awaitLatch(release);
            s.appendTurn(Turn.user("0", clock.instant()));
            return null;
        }));
        holder.start();
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();

        List<Thread> waiters = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            String text = String.valueOf(i);
            Thread t = new Thread(() -> store.withLock(id, s -> {
                s.appendTurn(Turn.user(text, clock.instant()));
                return null;
            }));
            t.start();
            // queue strictly one after another
            await().atMost(Duration.ofSeconds(2))
                    .until(() -> t.getState() == Thread.State.TIMED_WAITING);
            waiters.add(t);
        }

        release.countDown();
        holder.join(2000);
        for (Thread t : waiters) {
            t.join(2000);
        }

        assertThat(store.find(id).orElseThrow().getHistory())
                .extracting(Turn::text)
                .containsExactly("0", "1", "2", "3", "4", "5");
    }

    @Test
    void sweepRemovesOnlyConversationsIdleBeyondTtl() {
        String stale = store.getOrCreate(null).getConversationId();
        clock.advance(Duration.ofMinutes(20));
        String fresh = store.getOrCreate(null).getConversationId();
        clock.advance(Duration.ofMinutes(15));

        int removed = store.sweep(clock.instant());

        assertThat(removed).isEqualTo(1);
        assertThat(store.find(stale)).isEmpty();
        assertThat(store.find(fresh)).isPresent();
    }

    @Test
    void sweepKeepsConversationIdleExactlyTtl() {
        String id = store.getOrCreate(null).getConversationId();
        clock.advance(Duration.ofMinutes(30));

        assertThat(store.sweep(clock.instant())).isZero();
        assertThat(store.find(id)).isPresent();
    }

    @Test
    void sweepSkipsConversationWithTurnInFlight() throws Exception {
        String id = store.getOrCreate(null).getConversationId();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Thread holder = new Thread(() -> store.withLock(id, s -> {
            holding.countDown();
            awaitLatch(release);
            return null;
        }));
        holder.start();
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();
        clock.advance(Duration.ofHours(1));

        try {
            assertThat(store.sweep(clock.instant())).isZero();
            assertThat(store.find(id)).isPresent();
        } finally {
            release.countDown();
            holder.join(2000);
        }
    }

    @Test
    void turnRecreatesConversationSweptAfterCreation() {
        String id = store.getOrCreate("client-chosen").getConversationId();
        clock.advance(Duration.ofHours(1));
        assertThat(store.sweep(clock.instant())).isEqualTo(1);

        String step = store.<String>withLockForTurn("client-chosen", id, s -> {
            s.appendTurn(Turn.user("hello", clock.instant()));
            return s.getCurrentStepId();
        });

        assertThat(step).isEqualTo("Greeting");
        assertThat(store.find(id).orElseThrow().getHistory()).extracting(Turn::text).containsExactly("hello");
    }

    @Test
    void turnRecreatesGeneratedConversationEvenWithoutImplicitCreate() {
        props.setAllowImplicitCreate(false);
        String id = store.getOrCreate(null).getConversationId();
        clock.advance(Duration.ofHours(1));
        store.sweep(clock.instant());

        assertThat(store.<String>withLockForTurn(null, id, s -> "ran")).isEqualTo("ran");
        assertThat(store.find(id)).isPresent();
    }

    @Test
    void turnDoesNotRecreateClientIdWithoutImplicitCreate() {
        String id = store.getOrCreate("client-chosen").getConversationId();
        props.setAllowImplicitCreate(false);
        clock.advance(Duration.ofHours(1));
        store.sweep(clock.instant());

        assertThatThrownBy(() -> store.withLockForTurn("client-chosen", id, s -> null))
                .isInstanceOf(SessionNotFoundException.class);
        assertThat(store.find(id)).isEmpty();
    }

    @Test
    void resetReturnsToEntryStepAndClearsHistory() {
        String id = store.getOrCreate(null).getConversationId();
        store.withLock(id, s -> {
            s.setCurrentStepId("Confirm");
            s.putSlot("time", "19:00");
            s.appendTurn(Turn.user("hi", clock.instant()));
            return null;
        });

        SessionState reset = store.reset(id);

        assertThat(reset.getCurrentStepId()).isEqualTo("Greeting");
        assertThat(reset.getSlots()).isEmpty();
        assertThat(reset.getHistory()).isEmpty();
        assertThat(store.find(id).orElseThrow().getHistory()).isEmpty();
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
