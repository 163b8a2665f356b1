package com.phillippitts.hugdimon.service.dialog;

import java.util.Map;
import java.util.Set;

/**
 * Candidate slot values and intents found in one user input.
 */
public record SlotExtraction(Map<String, String> slots, Set<String> intents) {

    private static final SlotExtraction EMPTY = new SlotExtraction(Map.of(), Set.of());

    public SlotExtraction {
        slots = slots == null ? Map.of() : Map.copyOf(slots);
        intents = intents == null ? Set.of() : Set.copyOf(intents);
    }

    public static SlotExtraction empty() {
        return EMPTY;
    }
}
