package com.phillippitts.hugdimon.domain;

import java.util.Objects;

/**
 * Proverb attached to a generated reply.
 *
 * @param text        the proverb in Catalan
 * @param translation gloss in the conversation language, or English when that was not possible
 * @param label       caption for the gloss, e.g. "Traducción"
 */
public record ProverbReply(String text, String translation, String label) {

    public ProverbReply {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(translation, "translation must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
