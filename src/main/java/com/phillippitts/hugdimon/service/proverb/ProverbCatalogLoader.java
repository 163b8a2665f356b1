package com.phillippitts.hugdimon.service.proverb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the proverb catalog: {@code {"proverbs": [{"text", "translation", "sentiment"}]}} with
 * sentiment one of positive, negative or neutral.
 */
public class ProverbCatalogLoader {

    private static final Logger LOG = LogManager.getLogger(ProverbCatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public ProverbCatalogLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    /**
     * A missing catalog yields an empty list; the selector then falls back to its built-in
     * proverb.
     *
     * @throws IllegalStateException if the catalog exists but cannot be parsed
     */
    public List<Proverb> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            LOG.warn("Proverb catalog {} not found; replies will use the default proverb", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            List<Proverb> proverbs = new ArrayList<>();
            for (JsonNode node : root.path("proverbs")) {
                String text = node.path("text").asText("");
                String translation = node.path("translation").asText("");
                if (text.isBlank() || translation.isBlank()) {
                    LOG.debug("Skipping proverb entry without text or translation: {}", node);
                    continue;
                }
                proverbs.add(new Proverb(proverbs.size(), text, translation,
                        Mood.parse(node.path("sentiment").asText("neutral"))));
            }
            LOG.info("Loaded {} proverb(s) from {}", proverbs.size(), location);
            return List.copyOf(proverbs);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Cannot read proverb catalog " + location, e);
        }
    }
}
