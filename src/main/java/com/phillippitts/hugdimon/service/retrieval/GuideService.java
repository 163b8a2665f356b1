package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.config.properties.RetrievalProperties;
import com.phillippitts.hugdimon.domain.ContextChunk;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.ExternalServiceException.Kind;
import com.phillippitts.hugdimon.service.completion.CompletionInvoker;
import com.phillippitts.hugdimon.service.prompt.AssembledPrompt;
import com.phillippitts.hugdimon.service.prompt.PromptAssembler;
import com.phillippitts.hugdimon.service.validation.TurnInputValidator;
import com.phillippitts.hugdimon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Stateless place guide behind {@code POST /guide}.
 *
 * <p>Places scoring at least {@code guide-min-score} are listed straight from the catalog
 * without calling the model. When none qualify the question goes to the completion service
 * with the persona alone. Guide questions never touch conversation state.
 */
public class GuideService {

    private static final Logger LOG = LogManager.getLogger(GuideService.class);

    private static final String GUIDE_LANGUAGE = "en";

    private final ContextRetriever retriever;
    private final FeatureKeywordExtractor featureExtractor;
    private final PromptAssembler promptAssembler;
    private final CompletionInvoker completionInvoker;
    private final TurnInputValidator inputValidator;
    private final RetrievalProperties properties;
    private final Supplier<String> queryIds;

    public GuideService(ContextRetriever retriever,
                        FeatureKeywordExtractor featureExtractor,
                        PromptAssembler promptAssembler,
                        CompletionInvoker completionInvoker,
                        TurnInputValidator inputValidator,
                        RetrievalProperties properties) {
        this(retriever, featureExtractor, promptAssembler, completionInvoker, inputValidator, properties,
                () -> UUID.randomUUID().toString());
    }

    GuideService(ContextRetriever retriever,
                 FeatureKeywordExtractor featureExtractor,
                 PromptAssembler promptAssembler,
                 CompletionInvoker completionInvoker,
                 TurnInputValidator inputValidator,
                 RetrievalProperties properties,
                 Supplier<String> queryIds) {
        this.retriever = retriever;
        this.featureExtractor = featureExtractor;
        this.promptAssembler = promptAssembler;
        this.completionInvoker = completionInvoker;
        this.inputValidator = inputValidator;
        this.properties = properties;
        this.queryIds = queryIds;
    }

    /**
     * @throws com.phillippitts.hugdimon.exception.InvalidTurnException if the question is blank
     * @throws ExternalServiceException if no place matches and the completion fails
     */
    public GuideAnswer answer(String question) {
        String query = inputValidator.sanitizeMessage(question);
        String queryId = queryIds.get();
        Set<String> features = featureExtractor.requiredFeatures(query, GUIDE_LANGUAGE);
        List<ScoredChunk> places = retriever.query(query, properties.getTopK(), features).stream()
                .filter(s -> s.score() >= properties.getGuideMinScore())
                .toList();

        if (!places.isEmpty()) {
            LOG.info("Guide query {} answered from {} place(s), features={}", queryId, places.size(), features);
            return new GuideAnswer(queryId, format(places), GuideAnswer.Source.PLACES,
                    places.stream().map(s -> s.chunk().id()).toList());
        }

        LOG.info("Guide query {} matched no place; asking the model ('{}')", queryId, LogSanitizer.preview(query));
        AssembledPrompt prompt = promptAssembler.assemble(null, Map.of(), GUIDE_LANGUAGE, List.of(), List.of(), query);
        String text = completionInvoker.complete(prompt.text());
        if (text == null || text.isBlank()) {
            throw new ExternalServiceException(Kind.UNAVAILABLE, "completion", "Completion returned no text");
        }
        return new GuideAnswer(queryId, text.strip(), GuideAnswer.Source.COMPLETION, List.of());
    }

    static String format(List<ScoredChunk> places) {
        StringBuilder sb = new StringBuilder();
        for (ScoredChunk scored : places) {
            ContextChunk place = scored.chunk();
            Map<String, Object> meta = place.metadata();
            String name = String.valueOf(meta.getOrDefault("name", place.id()));
            String description = String.valueOf(meta.getOrDefault("description", ""));
            String email = String.valueOf(meta.getOrDefault("email", ""));
            boolean booking = Boolean.TRUE.equals(meta.get("has_booking"));

            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(name).append(": ").append(description).append('\n');
            sb.append(booking ? "Booking available" : "No booking");
            if (booking && !email.isEmpty()) {
                sb.append(". Contact for bookings: ").append(email);
            }
            sb.append(".\n");
            if (place.hasFeature(FeatureKeywordExtractor.HAS_TERRACE)) {
                sb.append("This place has a terrace.\n");
            }
            if (place.hasFeature(FeatureKeywordExtractor.SEA_VIEW)) {
                sb.append("It has a view of the sea.\n");
            }
        }
        return sb.toString().strip();
    }
}
