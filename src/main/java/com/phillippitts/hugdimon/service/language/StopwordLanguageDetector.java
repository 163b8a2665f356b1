package com.phillippitts.hugdimon.service.language;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Stop-word voting detector for en, es, fr, de, ca and ru.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>a Russian colloquial word (Привет, Ок, Норм...) forces {@code ru}</li>
 *   <li>Cyrillic letters give {@code ru}</li>
 *   <li>each token found in a language's word list votes for it; letters specific to a language
 *       (ñ, ç, ß, l·l...) add a vote; the highest vote wins, ties go to the earlier language in
 *       the order en, es, fr, de, ca</li>
 * </ol>
 * No votes at all yields {@link DetectedLanguage#undetermined()}.
 */
@Component
public class StopwordLanguageDetector implements LanguageDetector {

    private static final List<String> FORCE_RUSSIAN =
            List.of("привет", "ну", "че", "чо", "емое", "ёмое", "йо", "норм", "лол", "ок", "понял");

    private static final Map<String, Set<String>> WORDS = new LinkedHashMap<>();
    private static final Map<String, String> MARKERS = new LinkedHashMap<>();

    static {
        WORDS.put("en", Set.of("the", "a", "an", "and", "or", "is", "are", "was", "i", "you", "we", "it", "they",
                "my", "your", "for", "to", "of", "in", "on", "at", "with", "what", "where", "when", "how", "can",
                "do", "does", "please", "book", "table", "tonight", "want", "would", "like", "there", "have",
                "hello", "hi", "thanks", "thank", "yes", "people", "time", "today", "tomorrow", "this", "that",
                "me", "near", "good", "best", "view", "sea", "terrace", "get", "any", "some", "which"));
        WORDS.put("es", Set.of("el", "los", "las", "una", "y", "es", "son", "está", "del", "con", "por",
                "para", "qué", "dónde", "cómo", "cuándo", "quiero", "mi", "hola", "gracias", "sí", "mesa",
                "personas", "hora", "esta", "noche", "hoy", "mañana", "bueno", "hay", "vista", "al",
                "quisiera", "puedo", "reservar", "dos", "tres", "cuatro"));
        WORDS.put("fr", Set.of("le", "les", "une", "et", "est", "sont", "du", "des", "dans", "avec", "pour",
                "qui", "où", "comment", "quand", "je", "vous", "nous", "il", "elle", "bonjour", "merci", "oui",
                "non", "réserver", "personnes", "heure", "ce", "soir", "demain", "voudrais", "veux", "sur",
                "vue", "mer", "aujourd'hui", "deux", "trois", "quatre", "s'il", "plaît"));
        WORDS.put("de", Set.of("der", "die", "das", "ein", "eine", "und", "oder", "ist", "sind", "von", "zu",
                "mit", "für", "was", "wo", "wie", "wann", "ich", "du", "sie", "wir", "hallo", "danke", "ja",
                "nein", "tisch", "reservieren", "personen", "uhr", "heute", "abend", "morgen", "möchte",
                "gibt", "bitte", "meerblick", "zwei", "drei", "vier", "einen"));
        WORDS.put("ca", Set.of("els", "i", "és", "són", "amb", "per", "què", "on", "quan", "vull", "em",
                "gràcies", "taula", "persones", "aquesta", "nit", "avui", "demà", "hi", "ha", "vistes", "dues",
                "voldria", "reservar", "bon", "dia", "molt", "gràcia"));
        WORDS.put("ru", Set.of());

        MARKERS.put("es", "ñ¿¡");
        MARKERS.put("fr", "êœûùâî");
        MARKERS.put("de", "äöüß");
        MARKERS.put("ca", "·ŀ");
    }

    @Override
    public DetectedLanguage detect(String text) {
        if (text == null || text.isBlank()) {
            return DetectedLanguage.undetermined();
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        String[] tokens = lowered.split("[^\\p{L}'·]+");

        if (Arrays.stream(tokens).anyMatch(FORCE_RUSSIAN::contains)) {
            return new DetectedLanguage("ru", 1.0);
        }
        long cyrillic = lowered.codePoints()
                .filter(cp -> Character.UnicodeScript.of(cp) == Character.UnicodeScript.CYRILLIC)
                .count();
        long letters = lowered.codePoints().filter(Character::isLetter).count();
        if (cyrillic > 0 && cyrillic * 2 >= letters) {
            return new DetectedLanguage("ru", Math.min(1.0, (double) cyrillic / letters));
        }

        Map<String, Integer> votes = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<String, Set<String>> e : WORDS.entrySet()) {
            int v = 0;
            for (String token : tokens) {
                if (!token.isEmpty() && e.getValue().contains(token)) {
                    v++;
                }
            }
            String markers = MARKERS.get(e.getKey());
            if (markers != null && lowered.chars().anyMatch(c -> markers.indexOf(c) >= 0)) {
                v++;
            }
            votes.put(e.getKey(), v);
            total += v;
        }
        if (total == 0) {
            return DetectedLanguage.undetermined();
        }
        String best = null;
        int bestVotes = 0;
        for (Map.Entry<String, Integer> e : votes.entrySet()) {
            if (e.getValue() > bestVotes) {
                best = e.getKey();
                bestVotes = e.getValue();
            }
        }
        return new DetectedLanguage(best, (double) bestVotes / total);
    }
}
