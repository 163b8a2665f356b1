package com.phillippitts.hugdimon.service.dialog;

import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.exception.DialogScriptException;
import com.phillippitts.hugdimon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic state machine over a {@link DialogScript}.
 *
 * <p>{@link #advance} is a pure function of its inputs plus the {@link SlotExtractor}: it never
 * mutates the given state. The same script, state and input always produce the same
 * {@link DialogOutcome}.
 *
 * <p>Evaluation order for a non-terminal step:
 * <ol>
 *   <li>extract candidate slots and intents from the input</li>
 *   <li>merge candidates over the slots already collected</li>
 *   <li>take the first transition, in declaration order, whose condition matches</li>
 *   <li>no match: enter the fallback step if declared, otherwise stay and ask to clarify</li>
 * </ol>
 * Entering a terminal step signals {@link DialogAction#HANDOFF_TO_FREEFORM}. Advancing from a
 * terminal step changes nothing and repeats the hand-off signal.
 */
@Service
public class DialogEngine {

    private static final Logger LOG = LogManager.getLogger(DialogEngine.class);

    private final SlotExtractor slotExtractor;

    public DialogEngine(SlotExtractor slotExtractor) {
        this.slotExtractor = Objects.requireNonNull(slotExtractor, "slotExtractor");
    }

    /**
     * Computes the effect of one user input on the conversation.
     *
     * @param script    validated script
     * @param state     current state, read only
     * @param userInput sanitized user text (pivot language when translation is configured)
     * @param language  language code of {@code userInput}
     * @return outcome to apply on commit
     * @throws DialogScriptException if the state points at a step the script does not declare
     */
    public DialogOutcome advance(DialogScript script, SessionState state, String userInput, String language) {
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(state, "state");
        DialogStep current = script.step(state.getCurrentStepId());

        if (current.terminal()) {
            return new DialogOutcome(current.id(), Map.of(), List.of(),
                    EnumSet.of(DialogAction.HANDOFF_TO_FREEFORM), Set.of());
        }

        SlotExtraction extraction = safeExtract(userInput, current.requiredSlots(), language);

        Map<String, String> updates = new LinkedHashMap<>();
        extraction.slots().forEach((name, value) -> {
            if (!value.equals(state.getSlots().get(name))) {
                updates.put(name, value);
            }
        });
        Map<String, String> merged = new LinkedHashMap<>(state.getSlots());
        merged.putAll(updates);

        for (Transition transition : current.transitions()) {
            if (transition.condition().matches(merged, extraction.intents())) {
                transition.clearSlots().forEach(updates::remove);
                EnumSet<DialogAction> actions = EnumSet.noneOf(DialogAction.class);
                if (script.step(transition.target()).terminal()) {
                    actions.add(DialogAction.HANDOFF_TO_FREEFORM);
                }
                LOG.debug("Step {} -> {} (condition {})", current.id(), transition.target(),
                        transition.condition().type());
                return new DialogOutcome(transition.target(), updates, transition.clearSlots(), actions,
                        extraction.intents());
            }
        }

        if (current.fallback() != null) {
            EnumSet<DialogAction> actions = EnumSet.of(DialogAction.FALLBACK);
            if (script.step(current.fallback()).terminal()) {
                actions.add(DialogAction.HANDOFF_TO_FREEFORM);
            }
            LOG.debug("Step {} fell back to {}", current.id(), current.fallback());
            return new DialogOutcome(current.fallback(), updates, List.of(), actions, extraction.intents());
        }

        LOG.debug("Step {} matched nothing for '{}', asking to clarify", current.id(),
                LogSanitizer.preview(userInput));
        return new DialogOutcome(current.id(), updates, List.of(), EnumSet.of(DialogAction.CLARIFY),
                extraction.intents());
    }

    private SlotExtraction safeExtract(String input, List<String> requested, String language) {
        try {
            SlotExtraction result = slotExtractor.extract(input, requested, language);
            return result != null ? result : SlotExtraction.empty();
        } catch (RuntimeException e) {
            LOG.warn("Slot extraction failed; continuing without candidates: {}", e.getMessage());
            return SlotExtraction.empty();
        }
    }
}
