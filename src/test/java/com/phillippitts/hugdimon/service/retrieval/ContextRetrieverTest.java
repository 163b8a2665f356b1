package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.domain.ContextChunk;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ContextRetrieverTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

    /** Maps every query to the same fixed vector. */
    private static class FixedModel implements EmbeddingModel {
        private final float[] vector;

        FixedModel(float... vector) {
            this.vector = vector;
        }

        @Override
        public float[] embed(String text) {
            return vector.clone();
        }

        @Override
        public int dimension() {
            return vector.length;
        }
    }

    private KnowledgeIndex index;
    private ContextRetriever retriever;

    @BeforeEach
    void setUp() {
        index = new KnowledgeIndex(2);
        retriever = new ContextRetriever(index, new FixedModel(1f, 0f));
    }

    private static ContextChunk chunk(String id, Instant at, Map<String, Object> metadata, float... v) {
        return new ContextChunk(id, "test", id + " text", v, metadata, at);
    }

    private static ContextChunk chunk(String id, Instant at, float... v) {
        return chunk(id, at, Map.of(), v);
    }

    @Test
    void ranksByCosineSimilarityDescending() {
        index.addAll(List.of(
                chunk("far", T0, 0f, 1f),
                chunk("near", T0, 1f, 0.1f),
                chunk("mid", T0, 1f, 1f)));

        List<ScoredChunk> result = retriever.query("anything", 3);

        assertThat(result).extracting(s -> s.chunk().id()).containsExactly("near", "mid", "far");
        assertThat(result.get(2).score()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void breaksTiesByNewestThenId() {
        index.addAll(List.of(
                chunk("b-old", T0, 1f, 0f),
                chunk("a-old", T0, 1f, 0f),
                chunk("z-new", T0.plusSeconds(60), 1f, 0f)));

        assertThat(retriever.query("q", 3)).extracting(s -> s.chunk().id())
                .containsExactly("z-new", "a-old", "b-old");
    }

    @Test
    void returnsAtMostK() {
        index.addAll(List.of(chunk("a", T0, 1f, 0f), chunk("b", T0, 0f, 1f)));

        assertThat(retriever.query("q", 1)).hasSize(1);
    }

    @Test
    void isDeterministicAgainstUnchangedIndex() {
        for (int i = 0; i < 20; i++) {
            index.add(chunk("c" + i, T0.plusSeconds(i % 3), 1f, (i % 5) / 5f));
        }

        List<String> first = retriever.query("q", 7).stream().map(s -> s.chunk().id()).toList();
        for (int i = 0; i < 10; i++) {
            assertThat(retriever.query("q", 7).stream().map(s -> s.chunk().id()).toList()).isEqualTo(first);
        }
    }

    @Test
    void emptyInputsYieldEmptyResult() {
        assertThat(retriever.query("q", 3)).isEmpty();

        index.add(chunk("a", T0, 1f, 0f));
        assertThat(retriever.query("   ", 3)).isEmpty();
        assertThat(retriever.query("q", 0)).isEmpty();
    }

    @Test
    void filtersByRequiredFeatures() {
        index.addAll(List.of(
                chunk("plain", T0, Map.of("features", Map.of("has_terrace", false)), 1f, 0f),
                chunk("terrace", T0, Map.of("features", Map.of("has_terrace", true)), 0f, 1f)));

        assertThat(retriever.query("q", 2, Set.of("has_terrace")))
                .extracting(s -> s.chunk().id()).containsExactly("terrace");
    }

    @Test
    void fallsBackToUnfilteredRankingWhenNothingHasFeatures() {
        index.addAll(List.of(chunk("a", T0, 1f, 0f), chunk("b", T0, 0f, 1f)));

        assertThat(retriever.query("q", 2, Set.of("sea_view")))
                .extracting(s -> s.chunk().id()).containsExactly("a", "b");
    }

    @Test
    void cachedQueryIsRankedOnceUntilIndexChanges() {
        AtomicInteger embeds = new AtomicInteger();
        EmbeddingModel counting = new FixedModel(1f, 0f) {
            @Override
            public float[] embed(String text) {
                embeds.incrementAndGet();
                return super.embed(text);
            }
        };
        ContextRetriever cached = new ContextRetriever(index, counting, 200, Duration.ofMinutes(30));
        index.add(chunk("a", T0, 1f, 0f));

        List<ScoredChunk> first = cached.query("terrace", 3, Set.of("has_terrace"));
        List<ScoredChunk> second = cached.query("terrace", 3, Set.of("has_terrace"));

        assertThat(second).isEqualTo(first);
        assertThat(embeds.get()).isEqualTo(1);

        index.add(chunk("b", T0, 1f, 0f));
        List<ScoredChunk> afterUpdate = cached.query("terrace", 3, Set.of("has_terrace"));

        assertThat(embeds.get()).isEqualTo(2);
        assertThat(afterUpdate).extracting(s -> s.chunk().id()).containsExactly("a", "b");
    }

    @Test
    void cacheKeyIncludesKAndFeatures() {
        AtomicInteger embeds = new AtomicInteger();
        EmbeddingModel counting = new FixedModel(1f, 0f) {
            @Override
            public float[] embed(String text) {
                embeds.incrementAndGet();
                return super.embed(text);
            }
        };
        ContextRetriever cached = new ContextRetriever(index, counting, 200, Duration.ofMinutes(30));
        index.add(chunk("a", T0, 1f, 0f));

        cached.query("sea", 1);
        cached.query("sea", 2);
        cached.query("sea", 2, Set.of("sea_view"));
        cached.query("sea", 2, Set.of("sea_view"));

        assertThat(embeds.get()).isEqualTo(3);
    }

    @Test
    void rejectsModelWithDifferentDimension() {
        assertThatThrownBy(() -> new ContextRetriever(index, new FixedModel(1f, 0f, 0f)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cosineOfZeroVectorIsZero() {
        assertThat(ContextRetriever.cosine(new float[]{0f, 0f}, new float[]{1f, 0f})).isZero();
    }
}
