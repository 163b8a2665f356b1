package com.phillippitts.hugdimon.service.orchestration;

import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.config.properties.LanguageProperties;
import com.phillippitts.hugdimon.config.properties.RetrievalProperties;
import com.phillippitts.hugdimon.service.completion.CompletionInvoker;
import com.phillippitts.hugdimon.service.dialog.DialogEngine;
import com.phillippitts.hugdimon.service.dialog.DialogScript;
import com.phillippitts.hugdimon.service.language.LanguagePipeline;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import com.phillippitts.hugdimon.service.prompt.PromptAssembler;
import com.phillippitts.hugdimon.service.proverb.ProverbSelector;
import com.phillippitts.hugdimon.service.retrieval.ContextRetriever;
import com.phillippitts.hugdimon.service.retrieval.FeatureKeywordExtractor;
import com.phillippitts.hugdimon.service.session.SessionStore;
import com.phillippitts.hugdimon.service.transcription.TranscriptionClient;
import com.phillippitts.hugdimon.service.validation.TurnInputValidator;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.Objects;

/**
 * Builder for {@link DefaultResponseCoordinator}, which has too many collaborators for a
 * readable constructor call.
 *
 * <pre>{@code
 * ResponseCoordinator coordinator = DefaultResponseCoordinatorBuilder.builder()
 *     .sessionStore(store)
 *     .script(script)
 *     ...
 *     .publisher(publisher)
 *     .build();
 * }</pre>
 *
 * <p>The transcription client is optional; without it voice turns are rejected. Without a
 * proverb selector replies carry no proverb. Metrics default to
 * {@link ConversationMetricsPublisher#NOOP} and the clock to UTC system time.
 *
 * @since 1.0
 */
public final class DefaultResponseCoordinatorBuilder {

    // Required dependencies
    private SessionStore sessionStore;
    private DialogScript script;
    private DialogEngine dialogEngine;
    private ContextRetriever contextRetriever;
    private FeatureKeywordExtractor featureExtractor;
    private PromptAssembler promptAssembler;
    private LanguagePipeline languagePipeline;
    private CompletionInvoker completionInvoker;
    private TurnInputValidator inputValidator;
    private CompletionProperties completionProperties;
    private LanguageProperties languageProperties;
    private RetrievalProperties retrievalProperties;
    private ApplicationEventPublisher publisher;

    // Optional dependencies
    private TranscriptionClient transcriptionClient;
    private ProverbSelector proverbSelector;
    private ConversationMetricsPublisher metricsPublisher;
    private Clock clock;

    private DefaultResponseCoordinatorBuilder() {
    }

    public static DefaultResponseCoordinatorBuilder builder() {
        return new DefaultResponseCoordinatorBuilder();
    }

    /**
     * @param sessionStore conversation state store (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder sessionStore(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
        return this;
    }

    /**
     * @param script active dialog script (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder script(DialogScript script) {
        this.script = script;
        return this;
    }

    /**
     * @param dialogEngine dialog state machine (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder dialogEngine(DialogEngine dialogEngine) {
        this.dialogEngine = dialogEngine;
        return this;
    }

    /**
     * @param contextRetriever knowledge retrieval (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder contextRetriever(ContextRetriever contextRetriever) {
        this.contextRetriever = contextRetriever;
        return this;
    }

    /**
     * @param featureExtractor feature filter extraction (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder featureExtractor(FeatureKeywordExtractor featureExtractor) {
        this.featureExtractor = featureExtractor;
        return this;
    }

    /**
     * @param promptAssembler prompt builder (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder promptAssembler(PromptAssembler promptAssembler) {
        this.promptAssembler = promptAssembler;
        return this;
    }

    /**
     * @param languagePipeline detection, translation and sentiment (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder languagePipeline(LanguagePipeline languagePipeline) {
        this.languagePipeline = languagePipeline;
        return this;
    }

    /**
     * @param completionInvoker completion with timeout and retries (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder completionInvoker(CompletionInvoker completionInvoker) {
        this.completionInvoker = completionInvoker;
        return this;
    }

    /**
     * @param inputValidator boundary validation (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder inputValidator(TurnInputValidator inputValidator) {
        this.inputValidator = inputValidator;
        return this;
    }

    /**
     * @param transcriptionClient speech-to-text for voice turns (optional)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder transcriptionClient(TranscriptionClient transcriptionClient) {
        this.transcriptionClient = transcriptionClient;
        return this;
    }

    /**
     * @param proverbSelector proverb attached to generated replies (optional)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder proverbSelector(ProverbSelector proverbSelector) {
        this.proverbSelector = proverbSelector;
        return this;
    }

    /**
     * @param completionProperties canned reply texts (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder completionProperties(CompletionProperties completionProperties) {
        this.completionProperties = completionProperties;
        return this;
    }

    /**
     * @param languageProperties default and pivot language (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder languageProperties(LanguageProperties languageProperties) {
        this.languageProperties = languageProperties;
        return this;
    }

    /**
     * @param retrievalProperties top-k (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder retrievalProperties(RetrievalProperties retrievalProperties) {
        this.retrievalProperties = retrievalProperties;
        return this;
    }

    /**
     * @param publisher Spring event publisher (required)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * @param metricsPublisher metrics front (optional)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder metricsPublisher(ConversationMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * @param clock time source (optional)
     * @return this builder
     */
    public DefaultResponseCoordinatorBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultResponseCoordinator build() {
        Objects.requireNonNull(sessionStore, "sessionStore is required");
        Objects.requireNonNull(script, "script is required");
        Objects.requireNonNull(dialogEngine, "dialogEngine is required");
        Objects.requireNonNull(contextRetriever, "contextRetriever is required");
        Objects.requireNonNull(featureExtractor, "featureExtractor is required");
        Objects.requireNonNull(promptAssembler, "promptAssembler is required");
        Objects.requireNonNull(languagePipeline, "languagePipeline is required");
        Objects.requireNonNull(completionInvoker, "completionInvoker is required");
        Objects.requireNonNull(inputValidator, "inputValidator is required");
        Objects.requireNonNull(completionProperties, "completionProperties is required");
        Objects.requireNonNull(languageProperties, "languageProperties is required");
        Objects.requireNonNull(retrievalProperties, "retrievalProperties is required");
        Objects.requireNonNull(publisher, "publisher is required");

        return new DefaultResponseCoordinator(
                sessionStore,
                script,
                dialogEngine,
                contextRetriever,
                featureExtractor,
                promptAssembler,
                languagePipeline,
                completionInvoker,
                inputValidator,
                transcriptionClient,
                proverbSelector,
                completionProperties,
                languageProperties,
                retrievalProperties,
                publisher,
                metricsPublisher != null ? metricsPublisher : ConversationMetricsPublisher.NOOP,
                clock != null ? clock : Clock.systemUTC()
        );
    }
}
