package com.phillippitts.hugdimon.service.proverb;

import java.util.Objects;

/**
 * A Catalan proverb with its English gloss.
 *
 * @param id          position in the catalog
 * @param text        the proverb in Catalan
 * @param translation English translation
 * @param mood        sentiment bucket it is picked for
 */
public record Proverb(int id, String text, String translation, Mood mood) {

    public Proverb {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(translation, "translation must not be null");
        Objects.requireNonNull(mood, "mood must not be null");
    }
}
