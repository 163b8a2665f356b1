package com.phillippitts.hugdimon.service.language;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Polarity lexicon scorer covering the supported languages.
 *
 * <p>Score is {@code (positive - negative) / (positive + negative)} over matched words, 0 when
 * nothing matched. A negation word directly before a polar word flips that word.
 */
@Component
public class LexiconSentimentScorer implements SentimentScorer {

    private static final Set<String> POSITIVE = Set.of(
            "good", "great", "excellent", "amazing", "love", "lovely", "nice", "wonderful", "perfect",
            "happy", "thanks", "thank", "beautiful", "delicious", "fantastic", "awesome", "best",
            "bueno", "buena", "genial", "excelente", "gracias", "encanta", "perfecto", "maravilloso", "precioso",
            "bon", "bonne", "super", "merci", "parfait", "magnifique", "délicieux", "génial",
            "gut", "toll", "danke", "wunderbar", "perfekt", "schön", "lecker",
            "bo", "bona", "gràcies", "perfecte", "meravellós", "preciós",
            "хорошо", "отлично", "спасибо", "прекрасно", "супер", "класс", "люблю", "вкусно");
    private static final Set<String> NEGATIVE = Set.of(
            "bad", "terrible", "awful", "hate", "horrible", "worst", "sad", "angry", "disappointed",
            "poor", "rude", "dirty", "expensive", "boring", "wrong",
            "malo", "mala", "odio", "triste", "caro", "sucio", "aburrido",
            "mauvais", "mauvaise", "nul", "déteste", "cher", "sale",
            "schlecht", "schrecklich", "hasse", "traurig", "teuer", "schmutzig",
            "dolent", "dolenta", "trist", "car", "brut",
            "плохо", "ужасно", "ненавижу", "грустно", "дорого", "отвратительно");
    private static final Set<String> NEGATIONS = Set.of("not", "no", "never", "ni", "pas", "nicht", "kein", "не", "mai");

    @Override
    public double score(String text) {
        if (text == null || text.isBlank()) {
            return 0.0;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}']+");
        int positive = 0;
        int negative = 0;
        boolean negated = false;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            if (NEGATIONS.contains(token)) {
                negated = true;
                continue;
            }
            boolean pos = POSITIVE.contains(token);
            boolean neg = NEGATIVE.contains(token);
            if (pos != neg) {
                if (pos ^ negated) {
                    positive++;
                } else {
                    negative++;
                }
            }
            negated = false;
        }
        int matched = positive + negative;
        return matched == 0 ? 0.0 : (double) (positive - negative) / matched;
    }
}
