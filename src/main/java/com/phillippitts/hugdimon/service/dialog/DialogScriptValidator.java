package com.phillippitts.hugdimon.service.dialog;

import com.phillippitts.hugdimon.exception.DialogScriptException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks run before a {@link DialogScript} is built.
 *
 * <p>Rules:
 * <ul>
 *   <li>name and entry step are set, the entry step exists</li>
 *   <li>step ids are non-blank and unique, every step has at least one prompt</li>
 *   <li>every transition and fallback target is a declared step</li>
 *   <li>conditions are complete: SLOTS_FILLED lists slots, INTENT names an intent</li>
 *   <li>terminal steps declare no transitions and no fallback</li>
 *   <li>at least one terminal step is reachable from the entry step</li>
 * </ul>
 */
public final class DialogScriptValidator {

    private DialogScriptValidator() {
    }

    public static void validate(String name, String entryStepId, List<DialogStep> steps) {
        String scriptName = name == null ? "<unnamed>" : name;
        if (name == null || name.isBlank()) {
            throw new DialogScriptException(scriptName, "script name is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new DialogScriptException(scriptName, "script declares no steps");
        }
        if (entryStepId == null || entryStepId.isBlank()) {
            throw new DialogScriptException(scriptName, "entry step is required");
        }

        Map<String, DialogStep> byId = new HashMap<>();
        for (DialogStep step : steps) {
            if (step == null || step.id() == null || step.id().isBlank()) {
                throw new DialogScriptException(scriptName, "step without id");
            }
            if (byId.put(step.id(), step) != null) {
                throw new DialogScriptException(scriptName, "duplicate step id '" + step.id() + "'");
            }
            if (step.prompts().isEmpty()) {
                throw new DialogScriptException(scriptName, "step '" + step.id() + "' declares no prompt");
            }
        }
        if (!byId.containsKey(entryStepId)) {
            throw new DialogScriptException(scriptName, "entry step '" + entryStepId + "' is not declared");
        }

        for (DialogStep step : steps) {
            checkStep(scriptName, step, byId);
        }

        if (!terminalReachable(entryStepId, byId)) {
            throw new DialogScriptException(scriptName,
                    "no terminal step is reachable from entry step '" + entryStepId + "'");
        }
    }

    private static void checkStep(String scriptName, DialogStep step, Map<String, DialogStep> byId) {
        if (step.terminal() && (!step.transitions().isEmpty() || step.fallback() != null)) {
            throw new DialogScriptException(scriptName,
                    "terminal step '" + step.id() + "' must not declare transitions or a fallback");
        }
        for (Transition t : step.transitions()) {
            if (t == null || t.condition() == null || t.condition().type() == null) {
                throw new DialogScriptException(scriptName, "step '" + step.id() + "' has a transition without condition");
            }
            TransitionCondition c = t.condition();
            if (c.type() == ConditionType.SLOTS_FILLED && c.slots().isEmpty()) {
                throw new DialogScriptException(scriptName,
                        "step '" + step.id() + "' has a SLOTS_FILLED condition without slots");
            }
            if (c.type() == ConditionType.INTENT && (c.intent() == null || c.intent().isBlank())) {
                throw new DialogScriptException(scriptName,
                        "step '" + step.id() + "' has an INTENT condition without intent");
            }
            if (t.target() == null || !byId.containsKey(t.target())) {
                throw new DialogScriptException(scriptName,
                        "step '" + step.id() + "' transitions to undeclared step '" + t.target() + "'");
            }
        }
        if (step.fallback() != null && !byId.containsKey(step.fallback())) {
            throw new DialogScriptException(scriptName,
                    "step '" + step.id() + "' falls back to undeclared step '" + step.fallback() + "'");
        }
    }

    private static boolean terminalReachable(String entryStepId, Map<String, DialogStep> byId) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(entryStepId);
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (!seen.add(id)) {
                continue;
            }
            DialogStep step = byId.get(id);
            if (step.terminal()) {
                return true;
            }
            step.transitions().forEach(t -> queue.add(t.target()));
            if (step.fallback() != null) {
                queue.add(step.fallback());
            }
        }
        return false;
    }
}
