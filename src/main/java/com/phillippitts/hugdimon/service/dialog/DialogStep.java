package com.phillippitts.hugdimon.service.dialog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One node of a {@link DialogScript}.
 *
 * @param id            unique step id
 * @param prompts       prompt template per language code; {@code {slot}} placeholders are
 *                      substituted with collected slot values
 * @param requiredSlots slots this step tries to collect
 * @param transitions   outgoing edges, evaluated in declaration order
 * @param fallback      step entered when no transition matches, or null to stay and clarify
 * @param terminal      true for the final step of the scripted flow
 */
public record DialogStep(String id,
                         Map<String, String> prompts,
                         List<String> requiredSlots,
                         List<Transition> transitions,
                         String fallback,
                         boolean terminal) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_]+)}");

    public DialogStep {
        prompts = prompts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prompts));
        requiredSlots = requiredSlots == null ? List.of() : List.copyOf(requiredSlots);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    /**
     * Returns the template for {@code language}, falling back to {@code defaultLanguage} and then
     * to the first declared template.
     */
    public String template(String language, String defaultLanguage) {
        String t = prompts.get(language);
        if (t == null) {
            t = prompts.get(defaultLanguage);
        }
        if (t == null && !prompts.isEmpty()) {
            t = prompts.values().iterator().next();
        }
        return t == null ? "" : t;
    }

    /** @return the language the {@link #template} lookup resolves to */
    public String templateLanguage(String language, String defaultLanguage) {
        if (prompts.containsKey(language)) {
            return language;
        }
        if (prompts.containsKey(defaultLanguage)) {
            return defaultLanguage;
        }
        return prompts.isEmpty() ? defaultLanguage : prompts.keySet().iterator().next();
    }

    /**
     * Renders the template for {@code language} with slot values substituted. Placeholders for
     * missing slots are left as written.
     */
    public String render(String language, String defaultLanguage, Map<String, String> slots) {
        return substitute(template(language, defaultLanguage), slots);
    }

    static String substitute(String template, Map<String, String> slots) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = slots.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group(0)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
