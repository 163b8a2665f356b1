package com.phillippitts.hugdimon.service.prompt;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Supplies the persona (system) text for a language.
 *
 * <p>Reads {@code classpath:prompts/<lang>.md}, falling back to {@code en.md} and then to a
 * built-in line. {@code {{lang}}} in the file is replaced with the language code. Files are
 * read once per language.
 */
@Component
public class PersonaProvider {

    private static final Logger LOG = LogManager.getLogger(PersonaProvider.class);

    static final String BUILT_IN = "Act as HugDimon, a mystical cat from Cadaqués. Speak warmly and briefly. "
            + "Answer in the user's language.";
    static final String PRACTICAL_SUFFIX = "\n\nRemember: be practical and informative when answering factual questions.";

    private static final List<String> FACTUAL_KEYWORDS =
            List.of("address", "how to get", "book", "reservation", "email", "phone");

    private final ResourceLoader resourceLoader;
    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public PersonaProvider(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * @param language    language code of the conversation
     * @param userMessage current user message; factual questions get a practical-tone suffix
     */
    public String persona(String language, String userMessage) {
        String base = cache.computeIfAbsent(language, this::load);
        if (isFactual(userMessage)) {
            return base + PRACTICAL_SUFFIX;
        }
        return base;
    }

    static boolean isFactual(String message) {
        if (message == null) {
            return false;
        }
        String lowered = message.toLowerCase(Locale.ROOT);
        return FACTUAL_KEYWORDS.stream().anyMatch(lowered::contains);
    }

    private String load(String language) {
        String content = read("classpath:prompts/" + language + ".md");
        if (content == null) {
            LOG.warn("Persona file not found for '{}'; using en.md", language);
            content = read("classpath:prompts/en.md");
        }
        if (content == null) {
            LOG.error("No persona file available; using built-in persona");
            return BUILT_IN;
        }
        return content.replace("{{lang}}", language).strip();
    }

    private String read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to read persona file {}: {}", location, e.getMessage());
            return null;
        }
    }
}
