package com.phillippitts.hugdimon.service.dialog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.hugdimon.exception.DialogScriptException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Reads dialog scripts from JSON resources and validates them.
 *
 * <p>Document layout:
 * <pre>
 * {
 *   "name": "restaurant_booking",
 *   "entry": "Greeting",
 *   "steps": [
 *     { "id": "Greeting",
 *       "prompts": { "en": "...", "es": "..." },
 *       "requiredSlots": ["party_size", "time"],
 *       "transitions": [
 *         { "when": { "type": "SLOTS_FILLED", "slots": ["party_size"] }, "target": "CollectTime" },
 *         { "when": { "type": "INTENT", "intent": "deny" }, "target": "Greeting", "clearSlots": ["time"] }
 *       ],
 *       "fallback": null,
 *       "terminal": false }
 *   ]
 * }
 * </pre>
 */
@Component
public class DialogScriptLoader {

    private static final Logger LOG = LogManager.getLogger(DialogScriptLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public DialogScriptLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    /**
     * Loads and validates the script at a Spring resource location.
     *
     * @throws DialogScriptException if the resource is missing, unreadable or invalid
     */
    public DialogScript load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DialogScriptException(location, "resource not found");
        }
        try (InputStream in = resource.getInputStream()) {
            DialogScript script = parse(in, location);
            LOG.info("Loaded dialog script '{}' from {} ({} steps, entry {})",
                    script.getName(), location, script.steps().size(), script.getEntryStepId());
            return script;
        } catch (IOException e) {
            throw new DialogScriptException(location, "cannot read resource", e);
        }
    }

    /**
     * Parses and validates a script document.
     *
     * @param source used in error messages when the document has no name
     */
    public DialogScript parse(InputStream in, String source) {
        ScriptDocument doc;
        try {
            doc = objectMapper.readValue(in, ScriptDocument.class);
        } catch (IOException e) {
            throw new DialogScriptException(source, "malformed document: " + e.getMessage(), e);
        }
        if (doc == null) {
            throw new DialogScriptException(source, "empty document");
        }
        List<DialogStep> steps = doc.steps() == null ? List.of() : doc.steps().stream()
                .map(DialogScriptLoader::toStep)
                .toList();
        return DialogScript.of(doc.name(), doc.entry(), steps);
    }

    private static DialogStep toStep(StepDocument s) {
        if (s == null) {
            return null;
        }
        List<Transition> transitions = s.transitions() == null ? List.of() : s.transitions().stream()
                .map(t -> new Transition(
                        t.when() == null ? null : new TransitionCondition(t.when().type(), t.when().slots(), t.when().intent()),
                        t.target(),
                        t.clearSlots()))
                .toList();
        return new DialogStep(s.id(), s.prompts(), s.requiredSlots(), transitions, s.fallback(), s.terminal());
    }

    record ScriptDocument(String name, String entry, List<StepDocument> steps) {
    }

    record StepDocument(String id,
                        Map<String, String> prompts,
                        List<String> requiredSlots,
                        List<TransitionDocument> transitions,
                        String fallback,
                        boolean terminal) {
    }

    record TransitionDocument(ConditionDocument when, String target, List<String> clearSlots) {
    }

    record ConditionDocument(ConditionType type, List<String> slots, String intent) {
    }
}
