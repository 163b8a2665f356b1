package com.phillippitts.hugdimon.config.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.hugdimon.config.properties.CompletionProperties;
import com.phillippitts.hugdimon.config.properties.DialogProperties;
import com.phillippitts.hugdimon.config.properties.LanguageProperties;
import com.phillippitts.hugdimon.config.properties.PromptProperties;
import com.phillippitts.hugdimon.config.properties.ProverbProperties;
import com.phillippitts.hugdimon.config.properties.RetrievalProperties;
import com.phillippitts.hugdimon.config.properties.SessionProperties;
import com.phillippitts.hugdimon.config.properties.TranslationProperties;
import com.phillippitts.hugdimon.service.completion.CompletionClient;
import com.phillippitts.hugdimon.service.completion.CompletionInvoker;
import com.phillippitts.hugdimon.service.dialog.DialogEngine;
import com.phillippitts.hugdimon.service.dialog.DialogScript;
import com.phillippitts.hugdimon.service.dialog.DialogScriptLoader;
import com.phillippitts.hugdimon.service.language.LanguageDetector;
import com.phillippitts.hugdimon.service.language.LanguagePipeline;
import com.phillippitts.hugdimon.service.language.SentimentScorer;
import com.phillippitts.hugdimon.service.language.Translator;
import com.phillippitts.hugdimon.service.metrics.ConversationMetricsPublisher;
import com.phillippitts.hugdimon.service.orchestration.DefaultResponseCoordinatorBuilder;
import com.phillippitts.hugdimon.service.orchestration.ResponseCoordinator;
import com.phillippitts.hugdimon.service.prompt.JtokkitTokenCounter;
import com.phillippitts.hugdimon.service.prompt.PersonaProvider;
import com.phillippitts.hugdimon.service.prompt.PromptAssembler;
import com.phillippitts.hugdimon.service.prompt.TokenCounter;
import com.phillippitts.hugdimon.service.proverb.ProverbCatalogLoader;
import com.phillippitts.hugdimon.service.proverb.ProverbSelector;
import com.phillippitts.hugdimon.service.retrieval.CatalogIndexLoader;
import com.phillippitts.hugdimon.service.retrieval.ContextRetriever;
import com.phillippitts.hugdimon.service.retrieval.EmbeddingModel;
import com.phillippitts.hugdimon.service.retrieval.FeatureKeywordExtractor;
import com.phillippitts.hugdimon.service.retrieval.GuideService;
import com.phillippitts.hugdimon.service.retrieval.HashingEmbeddingModel;
import com.phillippitts.hugdimon.service.retrieval.KnowledgeIndex;
import com.phillippitts.hugdimon.service.session.InMemorySessionStore;
import com.phillippitts.hugdimon.service.session.SessionStore;
import com.phillippitts.hugdimon.service.transcription.TranscriptionClient;
import com.phillippitts.hugdimon.service.validation.TurnInputValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;

/**
 * Wires the conversation pipeline. Collaborators that need constructor arguments beyond other
 * beans (script entry step, index dimension, default language) are created here rather than
 * scanned.
 */
@Configuration
public class OrchestrationConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationConfig.class);

    private final LanguageProperties languageProperties;

    public OrchestrationConfig(LanguageProperties languageProperties) {
        this.languageProperties = languageProperties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Loaded and validated at startup; an invalid script fails the context.
     */
    @Bean
    public DialogScript dialogScript(DialogScriptLoader loader, DialogProperties dialogProperties) {
        return loader.load(dialogProperties.getScriptLocation());
    }

    @Bean
    public SessionStore sessionStore(SessionProperties sessionProperties,
                                     CompletionProperties completionProperties,
                                     Clock clock,
                                     DialogScript dialogScript) {
        requireLockCoversCompletion(sessionProperties, completionProperties);
        return new InMemorySessionStore(sessionProperties, clock, dialogScript.getEntryStepId(),
                languageProperties.getDefaultLanguage());
    }

    /**
     * The session lock is held while the reply is generated, so a queued turn for the same
     * conversation must be able to wait out the slowest generation.
     *
     * @throws IllegalStateException when {@code hugdimon.session.lock-timeout} is shorter
     */
    static void requireLockCoversCompletion(SessionProperties session, CompletionProperties completion) {
        Duration worstCase = completion.worstCaseDuration();
        if (session.getLockTimeout().compareTo(worstCase) < 0) {
            throw new IllegalStateException("hugdimon.session.lock-timeout (" + session.getLockTimeout()
                    + ") must be at least the completion worst case (" + worstCase
                    + " = max-attempts x timeout + backoff)");
        }
    }

    @Bean
    public EmbeddingModel embeddingModel(RetrievalProperties retrievalProperties) {
        return new HashingEmbeddingModel(retrievalProperties.getEmbeddingDimension());
    }

    @Bean
    public KnowledgeIndex knowledgeIndex(EmbeddingModel embeddingModel) {
        return new KnowledgeIndex(embeddingModel.dimension());
    }

    @Bean
    public ContextRetriever contextRetriever(KnowledgeIndex knowledgeIndex,
                                             EmbeddingModel embeddingModel,
                                             RetrievalProperties retrievalProperties) {
        return new ContextRetriever(knowledgeIndex, embeddingModel, retrievalProperties.getQueryCacheSize(),
                retrievalProperties.getQueryCacheTtl());
    }

    @Bean
    public CatalogIndexLoader catalogIndexLoader(KnowledgeIndex knowledgeIndex,
                                                 EmbeddingModel embeddingModel,
                                                 ObjectMapper objectMapper,
                                                 ResourceLoader resourceLoader,
                                                 Clock clock) {
        return new CatalogIndexLoader(knowledgeIndex, embeddingModel, objectMapper, resourceLoader, clock);
    }

    /**
     * Indexes the configured catalog once the context is up.
     */
    @Bean
    public ApplicationRunner catalogIndexRunner(CatalogIndexLoader loader, RetrievalProperties retrievalProperties) {
        return args -> {
            int count = loader.load(retrievalProperties.getCatalogLocation());
            LOG.info("Knowledge index ready with {} chunks", count);
        };
    }

    @Bean
    public TokenCounter tokenCounter() {
        return new JtokkitTokenCounter();
    }

    @Bean
    public PromptAssembler promptAssembler(PersonaProvider personaProvider,
                                           TokenCounter tokenCounter,
                                           PromptProperties promptProperties) {
        return new PromptAssembler(personaProvider, tokenCounter, promptProperties,
                languageProperties.getDefaultLanguage());
    }

    /**
     * Translation is optional: without a {@link Translator} bean text passes through unchanged.
     */
    @Bean
    public LanguagePipeline languagePipeline(LanguageDetector detector,
                                             ObjectProvider<Translator> translator,
                                             SentimentScorer sentimentScorer,
                                             TranslationProperties translationProperties) {
        return new LanguagePipeline(detector, translator.getIfAvailable(), sentimentScorer,
                languageProperties, translationProperties);
    }

    @Bean
    public CompletionInvoker completionInvoker(CompletionClient completionClient,
                                               @Qualifier("completionExecutor") ThreadPoolTaskExecutor executor,
                                               CompletionProperties completionProperties,
                                               ConversationMetricsPublisher metricsPublisher) {
        return new CompletionInvoker(completionClient, executor.getThreadPoolExecutor(),
                completionProperties, metricsPublisher);
    }

    @Bean
    public GuideService guideService(ContextRetriever contextRetriever,
                                     FeatureKeywordExtractor featureExtractor,
                                     PromptAssembler promptAssembler,
                                     CompletionInvoker completionInvoker,
                                     TurnInputValidator inputValidator,
                                     RetrievalProperties retrievalProperties) {
        return new GuideService(contextRetriever, featureExtractor, promptAssembler, completionInvoker,
                inputValidator, retrievalProperties);
    }

    @Bean
    public ProverbCatalogLoader proverbCatalogLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new ProverbCatalogLoader(objectMapper, resourceLoader);
    }

    /**
     * Absent when {@code hugdimon.proverb.enabled} is false; replies then carry no proverb.
     */
    @Bean
    @ConditionalOnProperty(prefix = "hugdimon.proverb", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public ProverbSelector proverbSelector(ProverbCatalogLoader loader, ProverbProperties proverbProperties) {
        return new ProverbSelector(loader.load(proverbProperties.getCatalogLocation()),
                proverbProperties.getRecentWindow(), new Random());
    }

    // CHECKSTYLE.OFF: ParameterNumber - Bean factory method with many collaborators
    @Bean
    public ResponseCoordinator responseCoordinator(SessionStore sessionStore,
                                                   DialogScript dialogScript,
                                                   DialogEngine dialogEngine,
                                                   ContextRetriever contextRetriever,
                                                   FeatureKeywordExtractor featureExtractor,
                                                   PromptAssembler promptAssembler,
                                                   LanguagePipeline languagePipeline,
                                                   CompletionInvoker completionInvoker,
                                                   TurnInputValidator inputValidator,
                                                   ObjectProvider<TranscriptionClient> transcriptionClient,
                                                   ObjectProvider<ProverbSelector> proverbSelector,
                                                   CompletionProperties completionProperties,
                                                   RetrievalProperties retrievalProperties,
                                                   ApplicationEventPublisher publisher,
                                                   ConversationMetricsPublisher metricsPublisher,
                                                   Clock clock) {
        return DefaultResponseCoordinatorBuilder.builder()
                .sessionStore(sessionStore)
                .script(dialogScript)
                .dialogEngine(dialogEngine)
                .contextRetriever(contextRetriever)
                .featureExtractor(featureExtractor)
                .promptAssembler(promptAssembler)
                .languagePipeline(languagePipeline)
                .completionInvoker(completionInvoker)
                .inputValidator(inputValidator)
                .transcriptionClient(transcriptionClient.getIfAvailable())
                .proverbSelector(proverbSelector.getIfAvailable())
                .completionProperties(completionProperties)
                .languageProperties(languageProperties)
                .retrievalProperties(retrievalProperties)
                .publisher(publisher)
                .metricsPublisher(metricsPublisher)
                .clock(clock)
                .build();
    }
    // CHECKSTYLE.ON: ParameterNumber
}
