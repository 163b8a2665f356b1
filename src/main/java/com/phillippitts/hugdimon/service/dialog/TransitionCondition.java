package com.phillippitts.hugdimon.service.dialog;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guard of a {@link Transition}.
 *
 * @param type   condition kind
 * @param slots  slots that must be filled, for {@link ConditionType#SLOTS_FILLED}
 * @param intent intent name, for {@link ConditionType#INTENT}
 */
public record TransitionCondition(ConditionType type, List<String> slots, String intent) {

    public TransitionCondition {
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public static TransitionCondition slotsFilled(String... slots) {
        return new TransitionCondition(ConditionType.SLOTS_FILLED, List.of(slots), null);
    }

    public static TransitionCondition intent(String intent) {
        return new TransitionCondition(ConditionType.INTENT, List.of(), intent);
    }

    public static TransitionCondition always() {
        return new TransitionCondition(ConditionType.ALWAYS, List.of(), null);
    }

    /**
     * Evaluates the guard.
     *
     * @param filledSlots slots known after merging this turn's extraction
     * @param intents     intents recognised in this turn's input
     */
    public boolean matches(Map<String, String> filledSlots, Set<String> intents) {
        if (type == null) {
            return false;
        }
        return switch (type) {
            case SLOTS_FILLED -> slots.stream().allMatch(s -> {
                String v = filledSlots.get(s);
                return v != null && !v.isBlank();
            });
            case INTENT -> intent != null && intents.contains(intent);
            case ALWAYS -> true;
        };
    }
}
