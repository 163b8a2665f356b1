package com.phillippitts.hugdimon.service.language;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.phillippitts.hugdimon.config.properties.LanguageProperties;
import com.phillippitts.hugdimon.config.properties.TranslationProperties;
import com.phillippitts.hugdimon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Language handling around a turn: detection, fail-open translation and sentiment.
 *
 * <p>Holds no conversation state. Translation never fails a turn: a missing or failing
 * translator yields the input unchanged with {@code translated = false}. Successful translations
 * are cached by (source, target, text).
 */
public class LanguagePipeline {

    private static final Logger LOG = LogManager.getLogger(LanguagePipeline.class);

    private final LanguageDetector detector;
    private final Translator translator;
    private final SentimentScorer sentimentScorer;
    private final LanguageProperties languageProperties;
    private final Cache<CacheKey, String> translations;

    /**
     * @param translator may be null when no translation service is configured
     */
    public LanguagePipeline(LanguageDetector detector,
                            Translator translator,
                            SentimentScorer sentimentScorer,
                            LanguageProperties languageProperties,
                            TranslationProperties translationProperties) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.translator = translator;
        this.sentimentScorer = Objects.requireNonNull(sentimentScorer, "sentimentScorer");
        this.languageProperties = Objects.requireNonNull(languageProperties, "languageProperties");
        this.translations = Caffeine.newBuilder()
                .maximumSize(translationProperties.getCacheSize())
                .expireAfterWrite(translationProperties.getCacheTtl())
                .build();
        if (translator == null) {
            LOG.info("No translator configured; text passes through untranslated");
        }
    }

    public boolean isTranslationEnabled() {
        return translator != null;
    }

    public DetectedLanguage detect(String text, String previousLanguage) {
        return detect(text, previousLanguage, null);
    }

    /**
     * Determines the language of a user message.
     *
     * <ul>
     *   <li>a supported caller hint wins with confidence 1</li>
     *   <li>blank or digits-only text keeps {@code previousLanguage} (or the default) with confidence 0</li>
     *   <li>undetermined detection keeps {@code previousLanguage} (or the default)</li>
     *   <li>an unsupported code falls back to the default language</li>
     * </ul>
     */
    public DetectedLanguage detect(String text, String previousLanguage, String hint) {
        String fallback = languageProperties.isSupported(previousLanguage)
                ? previousLanguage
                : languageProperties.getDefaultLanguage();
        if (hint != null && languageProperties.isSupported(hint)) {
            return new DetectedLanguage(hint, 1.0);
        }
        if (text == null || text.isBlank() || isNumericOnly(text)) {
            return new DetectedLanguage(fallback, 0.0);
        }
        DetectedLanguage detected;
        try {
            detected = detector.detect(text);
        } catch (RuntimeException e) {
            LOG.warn("Language detection failed; using '{}': {}", fallback, e.getMessage());
            return new DetectedLanguage(fallback, 0.0);
        }
        if (detected == null || detected.isUndetermined()) {
            return new DetectedLanguage(fallback, 0.0);
        }
        if (!languageProperties.isSupported(detected.code())) {
            LOG.debug("Unsupported language '{}' detected; using '{}'", detected.code(),
                    languageProperties.getDefaultLanguage());
            return new DetectedLanguage(languageProperties.getDefaultLanguage(), 0.0);
        }
        return detected;
    }

    /**
     * Translates {@code text} from {@code source} into {@code target}. No-op for blank text or
     * identical languages.
     */
    public TranslationResult translate(String text, String source, String target) {
        if (text == null || text.isBlank() || Objects.equals(source, target)) {
            return TranslationResult.unchanged(text);
        }
        if (translator == null) {
            return TranslationResult.unchanged(text);
        }
        CacheKey key = new CacheKey(source, target, text);
        String cached = translations.getIfPresent(key);
        if (cached != null) {
            return new TranslationResult(cached, true);
        }
        try {
            String result = translator.translate(text, source, target);
            if (result == null || result.isBlank()) {
                return TranslationResult.unchanged(text);
            }
            translations.put(key, result);
            return new TranslationResult(result, true);
        } catch (RuntimeException e) {
            LOG.warn("Translation {}->{} failed, passing text through: {} ('{}')", source, target,
                    e.getMessage(), LogSanitizer.preview(text));
            return TranslationResult.unchanged(text);
        }
    }

    /** @return sentiment in [-1, 1]; 0 when scoring fails */
    public double sentiment(String text) {
        try {
            double score = sentimentScorer.score(text);
            if (Double.isNaN(score)) {
                return 0.0;
            }
            return Math.max(-1.0, Math.min(1.0, score));
        } catch (RuntimeException e) {
            LOG.warn("Sentiment scoring failed: {}", e.getMessage());
            return 0.0;
        }
    }

    static boolean isNumericOnly(String text) {
        String stripped = text.strip();
        return !stripped.isEmpty() && stripped.chars().allMatch(c -> Character.isDigit(c)
                || Character.isWhitespace(c) || c == '.' || c == ',' || c == ':');
    }

    private record CacheKey(String source, String target, String text) {
    }
}
