package com.phillippitts.hugdimon.service.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingModelTest {

    private final HashingEmbeddingModel model = new HashingEmbeddingModel(128);

    @Test
    void sameTextSameVector() {
        assertThat(model.embed("Sea view terrace")).containsExactly(model.embed("sea view terrace"));
    }

    @Test
    void vectorsAreUnitLength() {
        float[] v = model.embed("a quiet bar by the harbour");
        double norm = 0;
        for (float x : v) {
            norm += x * x;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
        assertThat(v).hasSize(128);
    }

    @Test
    void overlappingTextsAreMoreSimilarThanUnrelatedOnes() {
        float[] q = model.embed("restaurant with sea view");
        double related = ContextRetriever.cosine(q, model.embed("seafood restaurant with a sea view"));
        double unrelated = ContextRetriever.cosine(q, model.embed("lighthouse hiking trail"));

        assertThat(related).isGreaterThan(unrelated);
    }
}
