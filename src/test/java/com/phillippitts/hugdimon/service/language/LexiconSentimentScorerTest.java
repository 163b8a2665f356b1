package com.phillippitts.hugdimon.service.language;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LexiconSentimentScorerTest {

    private final LexiconSentimentScorer scorer = new LexiconSentimentScorer();

    @Test
    void positiveAndNegativeMessages() {
        assertThat(scorer.score("The food was great, thanks!")).isEqualTo(1.0);
        assertThat(scorer.score("C'était mauvais et cher")).isEqualTo(-1.0);
        assertThat(scorer.score("Good view, terrible service")).isZero();
    }

    @Test
    void negationFlipsPolarity() {
        assertThat(scorer.score("not good")).isEqualTo(-1.0);
    }

    @Test
    void neutralTextScoresZero() {
        assertThat(scorer.score("table for two at nine")).isZero();
        assertThat(scorer.score(null)).isZero();
    }
}
