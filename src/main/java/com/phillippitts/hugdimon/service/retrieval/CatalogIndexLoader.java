package com.phillippitts.hugdimon.service.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.hugdimon.domain.ContextChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a places catalog into {@link ContextChunk}s and publishes them into the
 * {@link KnowledgeIndex}. One chunk per place.
 *
 * <p>Catalog layout: {@code {"sections": [{"section": "...", "places": [{"name", "description",
 * "direction", "booking": {"has_booking", "email"}, "features": {"has_terrace", "sea_view",
 * "booking"}}]}]}}.
 */
public class CatalogIndexLoader {

    private static final Logger LOG = LogManager.getLogger(CatalogIndexLoader.class);

    private final KnowledgeIndex index;
    private final EmbeddingModel embeddingModel;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    public CatalogIndexLoader(KnowledgeIndex index,
                              EmbeddingModel embeddingModel,
                              ObjectMapper objectMapper,
                              ResourceLoader resourceLoader,
                              Clock clock) {
        this.index = index;
        this.embeddingModel = embeddingModel;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.clock = clock;
    }

    /**
     * Loads the catalog at {@code location} and replaces the index content with it. A missing
     * catalog leaves the index empty; retrieval then returns no context.
     *
     * @return number of indexed chunks
     * @throws IllegalStateException if the catalog exists but cannot be parsed
     */
    public int load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            LOG.warn("Knowledge catalog {} not found; retrieval will return no context", location);
            return 0;
        }
        try (InputStream in = resource.getInputStream()) {
            List<ContextChunk> chunks = toChunks(objectMapper.readTree(in), location);
            index.replaceAll(chunks);
            LOG.info("Indexed {} place(s) from {}", chunks.size(), location);
            return chunks.size();
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read knowledge catalog " + location, e);
        }
    }

    List<ContextChunk> toChunks(JsonNode root, String sourceId) {
        List<ContextChunk> chunks = new ArrayList<>();
        Instant now = clock.instant();
        for (JsonNode section : root.path("sections")) {
            String category = section.path("section").asText("Unknown");
            for (JsonNode place : section.path("places")) {
                String name = place.path("name").asText("Unknown");
                String description = place.path("description").asText("");
                String direction = place.path("direction").asText("");
                JsonNode booking = place.path("booking");
                boolean hasBooking = booking.isBoolean() ? booking.asBoolean() : booking.path("has_booking").asBoolean(false);
                String email = booking.path("email").asText("");

                JsonNode f = place.path("features");
                Map<String, Object> features = new LinkedHashMap<>();
                features.put(FeatureKeywordExtractor.HAS_TERRACE, f.path("has_terrace").asBoolean(false));
                features.put(FeatureKeywordExtractor.SEA_VIEW, f.path("sea_view").asBoolean(false));
                features.put(FeatureKeywordExtractor.BOOKING, f.path("booking").asBoolean(hasBooking));

                StringBuilder text = new StringBuilder(name).append('\n').append(description);
                if (!direction.isEmpty()) {
                    text.append("\nLocation: ").append(direction);
                }
                if (Boolean.TRUE.equals(features.get(FeatureKeywordExtractor.HAS_TERRACE))) {
                    text.append("\nHas a terrace.");
                }
                if (Boolean.TRUE.equals(features.get(FeatureKeywordExtractor.SEA_VIEW))) {
                    text.append("\nHas a sea view.");
                }
                if (Boolean.TRUE.equals(features.get(FeatureKeywordExtractor.BOOKING))) {
                    text.append("\nAccepts bookings");
                    text.append(email.isEmpty() ? "." : " at " + email + ".");
                }

                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("category", category);
                metadata.put("name", name);
                metadata.put("description", description);
                metadata.put("direction", direction);
                metadata.put("has_booking", hasBooking);
                metadata.put("email", email);
                metadata.put("features", features);

                String body = text.toString();
                chunks.add(new ContextChunk(slug(category) + "/" + slug(name), sourceId, body,
                        embeddingModel.embed(body), metadata, now));
            }
        }
        return chunks;
    }

    private static String slug(String s) {
        return s.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", "-").replaceAll("(^-|-$)", "");
    }
}
