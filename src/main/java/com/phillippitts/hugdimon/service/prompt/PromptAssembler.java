package com.phillippitts.hugdimon.service.prompt;

import com.phillippitts.hugdimon.config.properties.PromptProperties;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import com.phillippitts.hugdimon.domain.Speaker;
import com.phillippitts.hugdimon.domain.Turn;
import com.phillippitts.hugdimon.exception.PromptTooLargeException;
import com.phillippitts.hugdimon.service.dialog.DialogStep;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the completion prompt for a turn under a token budget.
 *
 * <p>Section order is fixed: persona, current step prompt, retrieved context (an optional
 * note, then chunks in rank order),
 * recent history (oldest first), user message. When the text exceeds the budget, history
 * turns are dropped oldest first, then context chunks lowest rank first. Persona, step prompt
 * and user message are never dropped or altered.
 *
 * <p>Output depends only on the inputs, the persona files and the configured budget.
 */
public class PromptAssembler {

    private static final Logger LOG = LogManager.getLogger(PromptAssembler.class);

    private final PersonaProvider personaProvider;
    private final TokenCounter tokenCounter;
    private final PromptProperties properties;
    private final String defaultLanguage;

    public PromptAssembler(PersonaProvider personaProvider,
                           TokenCounter tokenCounter,
                           PromptProperties properties,
                           String defaultLanguage) {
        this.personaProvider = Objects.requireNonNull(personaProvider, "personaProvider");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.defaultLanguage = Objects.requireNonNull(defaultLanguage, "defaultLanguage");
    }

    /**
     * @param step        current dialog step, or null in free-form mode
     * @param slots       collected slot values for template substitution
     * @param language    conversation language
     * @param chunks      retrieved context in rank order
     * @param history     full conversation history, oldest first
     * @param userMessage current user message
     * @throws PromptTooLargeException if persona, step prompt and user message alone exceed the budget
     */
    public AssembledPrompt assemble(DialogStep step,
                                    Map<String, String> slots,
                                    String language,
                                    List<ScoredChunk> chunks,
                                    List<Turn> history,
                                    String userMessage) {
        return assemble(step, slots, language, chunks, history, userMessage, null);
    }

    /**
     * Same as the six-argument form, with {@code contextNote} written at the top of the context
     * section. The note is shown only while at least one chunk survives trimming.
     */
    public AssembledPrompt assemble(DialogStep step,
                                    Map<String, String> slots,
                                    String language,
                                    List<ScoredChunk> chunks,
                                    List<Turn> history,
                                    String userMessage,
                                    String contextNote) {
        String persona = personaProvider.persona(language, userMessage);
        String stepText = step == null ? null : step.render(language, defaultLanguage, slots);

        int window = properties.getHistoryWindow();
        List<Turn> turns = new ArrayList<>(window <= 0 || history.isEmpty()
                ? List.of()
                : history.subList(Math.max(0, history.size() - window), history.size()));
        List<ScoredChunk> context = new ArrayList<>(chunks);
        int initialTurns = turns.size();
        int initialChunks = context.size();
        int budget = properties.getMaxTokens();

        while (true) {
            String text = render(persona, stepText, slots, contextNote, context, turns, userMessage);
            int tokens = tokenCounter.count(text);
            if (tokens <= budget) {
                AssembledPrompt prompt = new AssembledPrompt(text, tokens,
                        context.stream().map(s -> s.chunk().id()).toList(),
                        turns.size(),
                        initialChunks - context.size(),
                        initialTurns - turns.size());
                if (prompt.droppedChunks() > 0 || prompt.droppedHistoryTurns() > 0) {
                    LOG.info("Prompt trimmed to {}/{} tokens: dropped {} history turn(s), {} chunk(s)",
                            tokens, budget, prompt.droppedHistoryTurns(), prompt.droppedChunks());
                }
                return prompt;
            }
            if (!turns.isEmpty()) {
                turns.remove(0);
            } else if (!context.isEmpty()) {
                context.remove(context.size() - 1);
            } else {
                throw new PromptTooLargeException(tokens, budget);
            }
        }
    }

    private static String render(String persona,
                                 String stepText,
                                 Map<String, String> slots,
                                 String contextNote,
                                 List<ScoredChunk> context,
                                 List<Turn> turns,
                                 String userMessage) {
        StringBuilder sb = new StringBuilder();
        sb.append("### Persona\n").append(persona).append("\n\n");
        if (stepText != null) {
            sb.append("### Current step\n").append(stepText).append('\n');
            if (slots != null && !slots.isEmpty()) {
                sb.append("Collected so far: ").append(slots.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "))).append('\n');
            }
            sb.append('\n');
        }
        if (!context.isEmpty()) {
            sb.append("### Context\n");
            if (contextNote != null && !contextNote.isBlank()) {
                sb.append(contextNote).append('\n');
            }
            for (int i = 0; i < context.size(); i++) {
                sb.append('[').append(i + 1).append("] ").append(context.get(i).chunk().text()).append('\n');
            }
            sb.append('\n');
        }
        if (!turns.isEmpty()) {
            sb.append("### Conversation\n");
            for (Turn t : turns) {
                sb.append(t.speaker() == Speaker.USER ? "User: " : "Assistant: ").append(t.text()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("### User\n").append(userMessage);
        return sb.toString();
    }
}
