package com.phillippitts.hugdimon.service.proverb;

import java.util.Locale;

/**
 * Sentiment bucket a proverb is filed under.
 */
public enum Mood {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    /** Buckets a sentiment score by its sign. */
    public static Mood of(double sentiment) {
        if (sentiment > 0) {
            return POSITIVE;
        }
        if (sentiment < 0) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }

    /**
     * @throws IllegalArgumentException for anything other than positive, negative or neutral
     */
    public static Mood parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
