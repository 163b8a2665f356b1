package com.phillippitts.hugdimon.service.retrieval;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives required place features ({@code has_terrace}, {@code sea_view}, {@code booking}) from
 * user text by keyword matching in the user's language. Unsupported languages use the English
 * keywords.
 */
@Component
public class FeatureKeywordExtractor {

    public static final String HAS_TERRACE = "has_terrace";
    public static final String SEA_VIEW = "sea_view";
    public static final String BOOKING = "booking";

    private static final Map<String, Map<String, List<String>>> KEYWORDS = Map.of(
            HAS_TERRACE, Map.of(
                    "en", List.of("terrace", "outdoor", "patio"),
                    "es", List.of("terraza", "exterior", "patio"),
                    "fr", List.of("terrasse", "extérieur"),
                    "de", List.of("terrasse", "draußen"),
                    "ca", List.of("terrassa", "exterior"),
                    "ru", List.of("террас", "веранд", "уличн")),
            SEA_VIEW, Map.of(
                    "en", List.of("sea view", "ocean view", "water view"),
                    "es", List.of("vista al mar", "vistas al mar", "vista al océano"),
                    "fr", List.of("vue sur la mer", "vue sur l'océan"),
                    "de", List.of("meerblick", "ozeanblick"),
                    "ca", List.of("vistes al mar", "vista al mar"),
                    "ru", List.of("вид на море", "морской вид", "вид на океан")),
            BOOKING, Map.of(
                    "en", List.of("book", "reserve", "reservation"),
                    "es", List.of("reservar", "reserva", "reservación"),
                    "fr", List.of("réserver", "réservation"),
                    "de", List.of("buchen", "reservieren", "reservierung"),
                    "ca", List.of("reservar", "reserva"),
                    "ru", List.of("бронир", "резервир", "заказ", "забронировать")));

    private static final List<String> FEATURE_ORDER = List.of(HAS_TERRACE, SEA_VIEW, BOOKING);

    public Set<String> requiredFeatures(String text, String language) {
        Set<String> found = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String feature : FEATURE_ORDER) {
            Map<String, List<String>> byLanguage = KEYWORDS.get(feature);
            List<String> words = byLanguage.getOrDefault(language, byLanguage.get("en"));
            if (words.stream().anyMatch(lowered::contains)) {
                found.add(feature);
            }
        }
        return found;
    }
}
