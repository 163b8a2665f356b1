package com.phillippitts.hugdimon.service.dialog;

import com.phillippitts.hugdimon.exception.DialogScriptException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DialogScriptValidatorTest {

    private static DialogStep step(String id, Transition... transitions) {
        return new DialogStep(id, Map.of("en", id), List.of(), List.of(transitions), null, false);
    }

    private static DialogStep terminal(String id) {
        return new DialogStep(id, Map.of("en", id), List.of(), List.of(), null, true);
    }

    @Test
    void acceptsMinimalValidScript() {
        assertThatCode(() -> DialogScript.of("ok", "A",
                List.of(step("A", new Transition(TransitionCondition.always(), "B")), terminal("B"))))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingEntryStep() {
        assertThatThrownBy(() -> DialogScript.of("s", "Missing", List.of(terminal("A"))))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("entry step 'Missing' is not declared");
    }

    @Test
    void rejectsDuplicateIds() {
        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(terminal("A"), terminal("A"))))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("duplicate step id 'A'");
    }

    @Test
    void rejectsTerminalStepWithTransitions() {
        DialogStep bad = new DialogStep("A", Map.of("en", "a"), List.of(),
                List.of(new Transition(TransitionCondition.always(), "A")), null, true);

        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(bad)))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("terminal step 'A'");
    }

    @Test
    void rejectsUndeclaredFallback() {
        DialogStep a = new DialogStep("A", Map.of("en", "a"), List.of(),
                List.of(new Transition(TransitionCondition.always(), "B")), "Ghost", false);

        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(a, terminal("B"))))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("falls back to undeclared step 'Ghost'");
    }

    @Test
    void rejectsSlotsFilledConditionWithoutSlots() {
        DialogStep a = step("A", new Transition(new TransitionCondition(ConditionType.SLOTS_FILLED, List.of(), null), "B"));

        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(a, terminal("B"))))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("SLOTS_FILLED condition without slots");
    }

    @Test
    void rejectsUnreachableTerminal() {
        DialogStep a = step("A", new Transition(TransitionCondition.intent("loop"), "A"));

        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(a, terminal("Island"))))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("no terminal step is reachable");
    }

    @Test
    void rejectsStepWithoutPrompt() {
        DialogStep silent = new DialogStep("A", Map.of(), List.of(), List.of(), null, true);

        assertThatThrownBy(() -> DialogScript.of("s", "A", List.of(silent)))
                .isInstanceOf(DialogScriptException.class)
                .hasMessageContaining("declares no prompt");
    }
}
