package com.phillippitts.hugdimon.service.orchestration;

import com.phillippitts.hugdimon.config.logging.MdcFilter;
import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.config.properties.LanguageProperties;
import com.phillippitts.hugdimon.config.properties.RetrievalProperties;
import com.phillippitts.hugdimon.domain.ProverbReply;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import com.phillippitts.hugdimon.domain.SessionState;
import com.phillippitts.hugdimon.domain.Turn;
import com.phillippitts.hugdimon.domain.TurnOutcome;
import com.phillippitts.hugdimon.domain.TurnRequest;
import com.phillippitts.hugdimon.domain.TurnResponse;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceExceptionBuilder;
import com.phillippitts.hugdimon.exception.InvalidTurnException;
import com.phillippitts.hugdimon.exception.SessionBusyException;
import com.phillippitts.hugdimon.exception.SessionNotFoundException;
import com.phillippitts.hugdimon.service.completion.CompletionInvoker;
import com.phillippitts.hugdimon.service.dialog.DialogAction;
import com.phillippitts.hugdimon.service.dialog.DialogEngine;
import com.phillippitts.hugdimon.service.dialog.DialogOutcome;
import com.phillippitts.hugdimon.service.dialog.DialogScript;
import com.phillippitts.hugdimon.service.dialog.DialogStep;
import com.phillippitts.hugdimon.service.language.DetectedLanguage;
import com.phillippitts.hugdimon.service.language.LanguagePipeline;
import com.phillippitts.hugdimon.service.language.TranslationResult;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import com.phillippitts.hugdimon.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.hugdimon.service.prompt.AssembledPrompt;
import com.phillippitts.hugdimon.service.prompt.PromptAssembler;
import com.phillippitts.hugdimon.service.proverb.Proverb;
import com.phillippitts.hugdimon.service.proverb.ProverbSelector;
import com.phillippitts.hugdimon.service.retrieval.ContextRetriever;
import com.phillippitts.hugdimon.service.retrieval.FeatureKeywordExtractor;
import com.phillippitts.hugdimon.service.retrieval.FeatureSummary;
import com.phillippitts.hugdimon.service.session.SessionStore;
import com.phillippitts.hugdimon.service.transcription.Transcript;
import com.phillippitts.hugdimon.service.transcription.TranscriptionClient;
import com.phillippitts.hugdimon.service.validation.TurnInputValidator;
import com.phillippitts.hugdimon.util.LogSanitizer;
import com.phillippitts.hugdimon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs one conversation turn end to end.
 *
 * <p>Pipeline, all inside the conversation lock:
 * <ol>
 *   <li><b>Language:</b> detect the message language, score sentiment, and translate the
 *       message to the pivot language for slot extraction and retrieval when a translator
 *       is configured</li>
 *   <li><b>Dialog:</b> advance the script (skipped once the conversation went free-form)</li>
 *   <li><b>Retrieval:</b> best-effort context lookup, filtered by features named in the message
 *       and summarized in a note when some places offer them all</li>
 *   <li><b>Prompt:</b> persona, step prompt, context and windowed history within the token budget</li>
 *   <li><b>Generation:</b> completion with timeout and retries; on failure a canned reply, the
 *       step template or the degraded message, translated into the conversation language</li>
 *   <li><b>Commit:</b> slots, step, both turns, language, sentiment and the free-form flag</li>
 * </ol>
 *
 * <p>Generated replies also carry a Catalan proverb picked by the sentiment of the message. It
 * is returned next to the reply and not stored in the history.
 *
 * <p><b>Failure semantics:</b> completion failures degrade the reply but the turn still commits
 * exactly once. Oversized prompts, script faults, cancellation and unexpected collaborator
 * errors abort the turn: nothing is committed and a generic apology is returned. Boundary errors
 * (invalid input, unknown conversation, busy conversation) propagate to the caller.
 *
 * <p><b>Configuration:</b> Not annotated as {@code @Component}; see
 * {@link com.phillippitts.hugdimon.config.orchestration.OrchestrationConfig} for bean wiring.
 *
 * @see DefaultResponseCoordinatorBuilder
 * @see TurnCompletedEvent
 * @since 1.0
 */
public class DefaultResponseCoordinator implements ResponseCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultResponseCoordinator.class);

    /** ThreadContext key holding the current {@link TurnStage}. */
    public static final String TURN_STAGE = "turnStage";

    private static final String ENGLISH = "en";
    private static final String CATALAN = "ca";

    private final SessionStore sessionStore;
    private final DialogScript script;
    private final DialogEngine dialogEngine;
    private final ContextRetriever contextRetriever;
    private final FeatureKeywordExtractor featureExtractor;
    private final PromptAssembler promptAssembler;
    private final LanguagePipeline languagePipeline;
    private final CompletionInvoker completionInvoker;
    private final TurnInputValidator inputValidator;
    private final TranscriptionClient transcriptionClient;
    private final ProverbSelector proverbSelector;
    private final CompletionProperties completionProperties;
    private final LanguageProperties languageProperties;
    private final RetrievalProperties retrievalProperties;
    private final ApplicationEventPublisher publisher;
    private final ConversationMetricsPublisher metricsPublisher;
    private final Clock clock;

    // CHECKSTYLE.OFF: ParameterNumber - Package-private constructor only used by builder
    DefaultResponseCoordinator(SessionStore sessionStore,
                               DialogScript script,
                               DialogEngine dialogEngine,
                               ContextRetriever contextRetriever,
                               FeatureKeywordExtractor featureExtractor,
                               PromptAssembler promptAssembler,
                               LanguagePipeline languagePipeline,
                               CompletionInvoker completionInvoker,
                               TurnInputValidator inputValidator,
                               TranscriptionClient transcriptionClient,
                               ProverbSelector proverbSelector,
                               CompletionProperties completionProperties,
                               LanguageProperties languageProperties,
                               RetrievalProperties retrievalProperties,
                               ApplicationEventPublisher publisher,
                               ConversationMetricsPublisher metricsPublisher,
                               Clock clock) {
        this.sessionStore = sessionStore;
        this.script = script;
        this.dialogEngine = dialogEngine;
        this.contextRetriever = contextRetriever;
        this.featureExtractor = featureExtractor;
        this.promptAssembler = promptAssembler;
        this.languagePipeline = languagePipeline;
        this.completionInvoker = completionInvoker;
        this.inputValidator = inputValidator;
        this.transcriptionClient = transcriptionClient;
        this.proverbSelector = proverbSelector;
        this.completionProperties = completionProperties;
        this.languageProperties = languageProperties;
        this.retrievalProperties = retrievalProperties;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
        this.clock = clock;
    }
    // CHECKSTYLE.ON: ParameterNumber

    @Override
    public TurnResponse handleTurn(TurnRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        long startNanos = System.nanoTime();
        String message = inputValidator.sanitizeMessage(request.message());
        SessionState snapshot = sessionStore.getOrCreate(request.conversationId());
        String conversationId = snapshot.getConversationId();

        String previousConversationId = ThreadContext.get(MdcFilter.CONVERSATION_ID);
        ThreadContext.put(MdcFilter.CONVERSATION_ID, conversationId);
        try {
            TurnResult result;
            try {
                result = sessionStore.withLockForTurn(request.conversationId(), conversationId,
                        state -> runTurn(state, message, request.languageHint()));
            } catch (SessionBusyException e) {
                metricsPublisher.recordBusy();
                throw e;
            } catch (SessionNotFoundException | InvalidTurnException e) {
                throw e;
            } catch (RuntimeException e) {
                String stage = ThreadContext.get(TURN_STAGE);
                LOG.warn("Turn aborted at stage {} ({}): {}", stage, e.getClass().getSimpleName(),
                        e.getMessage());
                result = apology(conversationId, snapshot.getLanguage());
            }

            long durationNanos = System.nanoTime() - startNanos;
            LOG.info("Turn handled: outcome={}, language={}, step={}, durationMs={}",
                    result.response().outcome(), result.response().language(), result.stepId(),
                    durationNanos / TimeUtils.NANOS_PER_MILLI);
            publisher.publishEvent(new TurnCompletedEvent(conversationId, result.response().outcome(),
                    result.response().language(), result.stepId(), durationNanos, clock.instant()));
            return result.response();
        } finally {
            ThreadContext.remove(TURN_STAGE);
            if (previousConversationId != null) {
                ThreadContext.put(MdcFilter.CONVERSATION_ID, previousConversationId);
            } else {
                ThreadContext.remove(MdcFilter.CONVERSATION_ID);
            }
        }
    }

    @Override
    public TurnResponse handleVoiceTurn(String conversationId, byte[] audio) {
        if (transcriptionClient == null) {
            throw ExternalServiceExceptionBuilder.create("No transcription service configured")
                    .service("transcription")
                    .kind(ExternalServiceException.Kind.UNAVAILABLE)
                    .build();
        }
        inputValidator.validateAudio(audio);
        Transcript transcript = transcriptionClient.transcribe(audio);
        LOG.debug("Transcribed {} bytes: language={}, text='{}'", audio.length, transcript.language(),
                LogSanitizer.preview(transcript.text()));
        return handleTurn(new TurnRequest(conversationId, transcript.text(), transcript.language()));
    }

    @Override
    public boolean isVoiceEnabled() {
        return transcriptionClient != null;
    }

    @Override
    public List<Turn> dialogLog(String conversationId) {
        return sessionStore.find(conversationId)
                .map(SessionState::getHistory)
                .orElseThrow(() -> new SessionNotFoundException(conversationId));
    }

    @Override
    public SessionState reset(String conversationId) {
        SessionState state = sessionStore.reset(conversationId);
        LOG.debug("Conversation {} reset to step {}", conversationId, state.getCurrentStepId());
        return state;
    }

    private TurnResult runTurn(SessionState state, String message, String languageHint) {
        stage(TurnStage.RECEIVED);
        Instant receivedAt = clock.instant();

        DetectedLanguage detected = languagePipeline.detect(message, state.getLanguage(), languageHint);
        String language = detected.code();
        double sentiment = languagePipeline.sentiment(message);
        String pivot = languageProperties.getPivot();
        TranslationResult pivoted = languagePipeline.translate(message, language, pivot);
        String workingText = pivoted.text();
        String workingLanguage = pivoted.translated() ? pivot : language;
        stage(TurnStage.LANGUAGE_DETECTED);

        boolean freeform = state.isFreeform();
        if (!freeform && script.step(state.getCurrentStepId()).terminal()) {
            freeform = true;
        }
        DialogOutcome outcome = null;
        DialogStep step = null;
        Map<String, String> slots = new LinkedHashMap<>(state.getSlots());
        if (!freeform) {
            outcome = dialogEngine.advance(script, state, workingText, workingLanguage);
            slots.putAll(outcome.slotUpdates());
            outcome.clearedSlots().forEach(slots::remove);
            step = script.step(outcome.nextStepId());
            LOG.debug("Dialog {} -> {} actions={} updates={}", state.getCurrentStepId(),
                    outcome.nextStepId(), outcome.actions(), outcome.slotUpdates());
        }
        stage(TurnStage.DIALOG_ADVANCED);

        Set<String> features = featureExtractor.requiredFeatures(message, language);
        List<ScoredChunk> chunks = retrieve(workingText, features);
        stage(TurnStage.CONTEXT_RETRIEVED);

        AssembledPrompt prompt = promptAssembler.assemble(step, slots, language, chunks,
                state.getHistory(), message, FeatureSummary.describe(features, chunks));
        stage(TurnStage.PROMPT_ASSEMBLED);

        String reply = generate(prompt);
        TurnOutcome turnOutcome = TurnOutcome.GENERATED;
        boolean untranslated = false;
        stage(TurnStage.GENERATED);

        if (reply == null) {
            turnOutcome = TurnOutcome.DEGRADED;
            String sourceLanguage;
            if (step != null) {
                reply = step.render(language, languageProperties.getDefaultLanguage(), slots);
                sourceLanguage = step.templateLanguage(language, languageProperties.getDefaultLanguage());
            } else {
                reply = completionProperties.getDegradedMessage();
                sourceLanguage = languageProperties.getDefaultLanguage();
            }
            if (!sourceLanguage.equals(language)) {
                TranslationResult localized = languagePipeline.translate(reply, sourceLanguage, language);
                reply = localized.text();
                untranslated = !localized.translated();
            }
        }
        stage(TurnStage.TRANSLATED);

        if (outcome != null) {
            outcome.slotUpdates().forEach(state::putSlot);
            outcome.clearedSlots().forEach(state::removeSlot);
            state.setCurrentStepId(outcome.nextStepId());
        }
        Instant repliedAt = clock.instant();
        state.appendTurn(Turn.user(message, receivedAt));
        state.appendTurn(Turn.assistant(reply, repliedAt));
        state.setLanguage(language);
        state.recordSentiment(sentiment);
        state.touch(repliedAt);
        if (freeform || outcome.has(DialogAction.HANDOFF_TO_FREEFORM)) {
            state.setFreeform(true);
        }
        stage(TurnStage.COMMITTED);

        ProverbReply proverb = turnOutcome == TurnOutcome.GENERATED ? proverb(sentiment, language) : null;
        String stepId = state.isFreeform() ? null : state.getCurrentStepId();
        return new TurnResult(new TurnResponse(state.getConversationId(), reply, language, sentiment,
                turnOutcome, untranslated, proverb), stepId);
    }

    /**
     * Mood-matched proverb with its English gloss translated into the conversation language.
     * Catalan speakers get the English gloss. A failed translation keeps English and its label.
     */
    private ProverbReply proverb(double sentiment, String language) {
        if (proverbSelector == null) {
            return null;
        }
        Proverb chosen = proverbSelector.select(sentiment);
        if (ENGLISH.equals(language) || CATALAN.equals(language)) {
            return new ProverbReply(chosen.text(), chosen.translation(), ProverbSelector.glossLabel(language));
        }
        TranslationResult gloss = languagePipeline.translate(chosen.translation(), ENGLISH, language);
        String label = ProverbSelector.glossLabel(gloss.translated() ? language : ENGLISH);
        return new ProverbReply(chosen.text(), gloss.text(), label);
    }

    private List<ScoredChunk> retrieve(String workingText, Set<String> features) {
        try {
            return contextRetriever.query(workingText, retrievalProperties.getTopK(), features);
        } catch (RuntimeException e) {
            LOG.warn("Context retrieval failed, continuing without context: {}", e.getMessage());
            return List.of();
        }
    }

    /** @return the completion text, or null when the completion failed or came back blank */
    private String generate(AssembledPrompt prompt) {
        try {
            String text = completionInvoker.complete(prompt.text());
            if (text == null || text.isBlank()) {
                LOG.warn("Completion returned blank text; using canned reply");
                return null;
            }
            return text.strip();
        } catch (ExternalServiceException e) {
            LOG.warn("Completion failed ({}, service={}); using canned reply: {}", e.getKind(),
                    e.getServiceName(), e.getMessage());
            return null;
        }
    }

    private TurnResult apology(String conversationId, String language) {
        String text = completionProperties.getApologyMessage();
        String source = languageProperties.getDefaultLanguage();
        boolean untranslated = false;
        if (!source.equals(language)) {
            TranslationResult localized = languagePipeline.translate(text, source, language);
            text = localized.text();
            untranslated = !localized.translated();
        }
        return new TurnResult(new TurnResponse(conversationId, text, language, 0.0,
                TurnOutcome.APOLOGY, untranslated), null);
    }

    private static void stage(TurnStage stage) {
        ThreadContext.put(TURN_STAGE, stage.name());
    }

    private record TurnResult(TurnResponse response, String stepId) {}
}
