package com.phillippitts.hugdimon.service.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FeatureKeywordExtractorTest {

    private final FeatureKeywordExtractor extractor = new FeatureKeywordExtractor();

    @Test
    void findsFeaturesInMessageLanguage() {
        assertThat(extractor.requiredFeatures("Un restaurante con terraza y vista al mar", "es"))
                .containsExactly(FeatureKeywordExtractor.HAS_TERRACE, FeatureKeywordExtractor.SEA_VIEW);
    }

    @Test
    void unknownLanguageUsesEnglishKeywords() {
        assertThat(extractor.requiredFeatures("can I book somewhere?", "xx"))
                .containsExactly(FeatureKeywordExtractor.BOOKING);
    }

    @Test
    void noKeywordsMeansNoFilter() {
        assertThat(extractor.requiredFeatures("hello cat", "en")).isEmpty();
        assertThat(extractor.requiredFeatures("", "en")).isEmpty();
    }
}
