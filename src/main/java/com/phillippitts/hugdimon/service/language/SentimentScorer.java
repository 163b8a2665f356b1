package com.phillippitts.hugdimon.service.language;

/** Scores the polarity of a text, negative to positive. */
public interface SentimentScorer {

    /** @return polarity, nominally in [-1, 1] */
    double score(String text);
}
