package com.phillippitts.hugdimon.service.dialog;

import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.testutil.TestScripts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DialogEngineTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private DialogScript script;
    private DialogEngine engine;

    @BeforeEach
    void setUp() {
        script = TestScripts.restaurant();
        engine = new DialogEngine(new PatternSlotExtractor());
    }

    private static SessionState at(String stepId) {
        SessionState s = new SessionState("c1", "Greeting", "en", NOW);
        s.setCurrentStepId(stepId);
        return s;
    }

    @Test
    void greetingWithPartySizeMovesToCollectTime() {
        DialogOutcome outcome = engine.advance(script, at("Greeting"), "Book a table for 2 tonight", "en");

        assertThat(outcome.nextStepId()).isEqualTo("CollectTime");
        assertThat(outcome.slotUpdates()).containsExactly(Map.entry("party_size", "2"));
        assertThat(outcome.actions()).isEmpty();
    }

    @Test
    void greetingWithBothSlotsJumpsToConfirm() {
        DialogOutcome outcome = engine.advance(script, at("Greeting"), "table for 4 at 8pm", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Confirm");
        assertThat(outcome.slotUpdates()).containsEntry("party_size", "4").containsEntry("time", "20:00");
    }

    @Test
    void greetingWithIntentOnlyAsksForPartySize() {
        DialogOutcome outcome = engine.advance(script, at("Greeting"), "I'd like to make a reservation", "en");

        assertThat(outcome.nextStepId()).isEqualTo("CollectPartySize");
    }

    @Test
    void unmatchedInputStaysAndAsksToClarify() {
        DialogOutcome outcome = engine.advance(script, at("CollectTime"), "hmm, not sure", "en");

        assertThat(outcome.nextStepId()).isEqualTo("CollectTime");
        assertThat(outcome.has(DialogAction.CLARIFY)).isTrue();
    }

    @Test
    void existingSlotsCountTowardsConditions() {
        SessionState s = at("CollectTime");
        s.putSlot("party_size", "2");

        DialogOutcome outcome = engine.advance(script, s, "19:30", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Confirm");
        assertThat(outcome.slotUpdates()).containsExactly(Map.entry("time", "19:30"));
    }

    @Test
    void affirmingConfirmationHandsOffToFreeform() {
        SessionState s = at("Confirm");
        s.putSlot("party_size", "2");
        s.putSlot("time", "19:30");

        DialogOutcome outcome = engine.advance(script, s, "yes", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Booked");
        assertThat(outcome.has(DialogAction.HANDOFF_TO_FREEFORM)).isTrue();
    }

    @Test
    void denyingConfirmationClearsSlotsAndRestarts() {
        SessionState s = at("Confirm");
        s.putSlot("party_size", "2");
        s.putSlot("time", "19:30");

        DialogOutcome outcome = engine.advance(script, s, "no", "en");

        assertThat(outcome.nextStepId()).isEqualTo("CollectPartySize");
        assertThat(outcome.clearedSlots()).containsExactlyInAnyOrder("party_size", "time");
    }

    @Test
    void advancingFromTerminalStepIsNoOp() {
        DialogOutcome outcome = engine.advance(script, at("Booked"), "for 6 people", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Booked");
        assertThat(outcome.slotUpdates()).isEmpty();
        assertThat(outcome.has(DialogAction.HANDOFF_TO_FREEFORM)).isTrue();
    }

    @Test
    void failingExtractorIsTreatedAsNoCandidates() {
        SlotExtractor broken = mock(SlotExtractor.class);
        when(broken.extract(anyString(), anyList(), any())).thenThrow(new IllegalStateException("boom"));
        DialogEngine withBroken = new DialogEngine(broken);

        DialogOutcome outcome = withBroken.advance(script, at("Greeting"), "for 2", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Greeting");
        assertThat(outcome.has(DialogAction.CLARIFY)).isTrue();
    }

    @Test
    void fallbackStepIsUsedWhenNothingMatches() {
        DialogStep ask = new DialogStep("Ask", Map.of("en", "?"), List.of(),
                List.of(new Transition(TransitionCondition.intent("affirm"), "End")), "Help", false);
        DialogStep help = new DialogStep("Help", Map.of("en", "help"), List.of(),
                List.of(new Transition(TransitionCondition.always(), "End")), null, false);
        DialogStep end = new DialogStep("End", Map.of("en", "bye"), List.of(), List.of(), null, true);
        DialogScript custom = DialogScript.of("custom", "Ask", List.of(ask, help, end));
        SessionState s = new SessionState("c2", "Ask", "en", NOW);

        DialogOutcome outcome = engine.advance(custom, s, "what?", "en");

        assertThat(outcome.nextStepId()).isEqualTo("Help");
        assertThat(outcome.actions()).isEqualTo(Set.of(DialogAction.FALLBACK));
    }
}
