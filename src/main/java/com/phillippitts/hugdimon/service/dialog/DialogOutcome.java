package com.phillippitts.hugdimon.service.dialog;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of advancing a conversation by one user input. Applying it is the caller's job.
 *
 * @param nextStepId   step the conversation is in after this turn
 * @param slotUpdates  new or changed slot values
 * @param clearedSlots slots to remove, applied after the updates
 * @param actions      signals for the coordinator
 * @param intents      intents recognised in the input
 */
public record DialogOutcome(String nextStepId,
                            Map<String, String> slotUpdates,
                            List<String> clearedSlots,
                            Set<DialogAction> actions,
                            Set<String> intents) {

    public DialogOutcome {
        slotUpdates = slotUpdates == null ? Map.of() : Map.copyOf(slotUpdates);
        clearedSlots = clearedSlots == null ? List.of() : List.copyOf(clearedSlots);
        actions = actions == null ? Set.of() : Set.copyOf(actions);
        intents = intents == null ? Set.of() : Set.copyOf(intents);
    }

    public boolean has(DialogAction action) {
        return actions.contains(action);
    }
}
