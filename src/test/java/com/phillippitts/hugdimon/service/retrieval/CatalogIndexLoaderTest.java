package com.phillippitts.hugdimon.service.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.hugdimon.domain.ContextChunk;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import com.phillippitts.hugdimon.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class CatalogIndexLoaderTest {

    private KnowledgeIndex index;
    private HashingEmbeddingModel model;
    private CatalogIndexLoader loader;

    @BeforeEach
    void setUp() {
        model = new HashingEmbeddingModel(256);
        index = new KnowledgeIndex(256);
        loader = new CatalogIndexLoader(index, model, new ObjectMapper(), new DefaultResourceLoader(),
                MutableClock.startingAt("2025-06-01T12:00:00Z"));
    }

    @Test
    void indexesEveryPlaceOfBundledCatalog() {
        int count = loader.load("classpath:knowledge/catalog.json");

        assertThat(count).isEqualTo(8);
        assertThat(index.size()).isEqualTo(8);
        assertThat(index.snapshot()).extracting(ContextChunk::id).contains("restaurants/casa-nun");
    }

    @Test
    void missingCatalogLeavesIndexEmpty() {
        assertThat(loader.load("classpath:knowledge/none.json")).isZero();
        assertThat(index.size()).isZero();
    }

    @Test
    void terraceQueryFindsTerracePlaces() {
        loader.load("classpath:knowledge/catalog.json");
        ContextRetriever retriever = new ContextRetriever(index, model);
        Set<String> features = new FeatureKeywordExtractor().requiredFeatures("any restaurant with a terrace?", "en");

        List<ScoredChunk> result = retriever.query("restaurant with a terrace", 3, features);

        assertThat(result).isNotEmpty();
        assertThat(result).allSatisfy(s -> assertThat(s.chunk().hasFeature("has_terrace")).isTrue());
    }
}
