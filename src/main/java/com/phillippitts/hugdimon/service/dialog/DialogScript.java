package com.phillippitts.hugdimon.service.dialog;

import com.phillippitts.hugdimon.exception.DialogScriptException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable dialog definition: an entry step and the steps reachable from it.
 *
 * <p>Instances are only created through {@link #of}, which runs {@link DialogScriptValidator},
 * so every transition and fallback target of a live script resolves to a declared step.
 */
public final class DialogScript {

    private final String name;
    private final String entryStepId;
    private final Map<String, DialogStep> steps;

    private DialogScript(String name, String entryStepId, Map<String, DialogStep> steps) {
        this.name = name;
        this.entryStepId = entryStepId;
        this.steps = steps;
    }

    /**
     * Validates and builds a script.
     *
     * @throws DialogScriptException if the definition breaks a structural rule
     */
    public static DialogScript of(String name, String entryStepId, List<DialogStep> steps) {
        DialogScriptValidator.validate(name, entryStepId, steps);
        Map<String, DialogStep> byId = new LinkedHashMap<>();
        for (DialogStep step : steps) {
            byId.put(step.id(), step);
        }
        return new DialogScript(name, entryStepId, Collections.unmodifiableMap(byId));
    }

    public String getName() {
        return name;
    }

    public String getEntryStepId() {
        return entryStepId;
    }

    public Optional<DialogStep> findStep(String id) {
        return Optional.ofNullable(id == null ? null : steps.get(id));
    }

    /**
     * @throws DialogScriptException if no step has this id
     */
    public DialogStep step(String id) {
        return findStep(id).orElseThrow(() ->
                new DialogScriptException(name, "unknown step '" + id + "'"));
    }

    public Collection<DialogStep> steps() {
        return steps.values();
    }

    @Override
    public String toString() {
        return "DialogScript{name=" + name + ", entry=" + entryStepId + ", steps=" + steps.keySet() + '}';
    }
}
