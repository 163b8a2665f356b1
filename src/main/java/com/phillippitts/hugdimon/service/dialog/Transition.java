package com.phillippitts.hugdimon.service.dialog;

import java.util.List;

/**
 * Edge between two dialog steps.
 *
 * @param condition  guard evaluated against the merged slots and recognised intents
 * @param target     id of the step entered when the guard matches
 * @param clearSlots slots removed when the transition is taken
 */
public record Transition(TransitionCondition condition, String target, List<String> clearSlots) {

    public Transition {
        clearSlots = clearSlots == null ? List.of() : List.copyOf(clearSlots);
    }

    public Transition(TransitionCondition condition, String target) {
        this(condition, target, List.of());
    }
}
