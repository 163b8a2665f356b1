package com.phillippitts.hugdimon.service.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.phillippitts.hugdimon.domain.ContextChunk;
import com.phillippitts.hugdimon.domain.ScoredChunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ranks indexed chunks by cosine similarity to a query.
 *
 * <p>Ordering is total and deterministic: score descending, then {@code indexedAt} descending,
 * then id ascending. Each call reads one {@link KnowledgeIndex#snapshot()}, so concurrent
 * index updates never produce a mixed view within one query.
 *
 * <p>With a positive cache size, rankings are cached per query text, {@code k}, required
 * features and index version, so any index update makes earlier entries unreachable.
 */
public class ContextRetriever {

    private static final Logger LOG = LogManager.getLogger(ContextRetriever.class);

    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparing((ScoredChunk s) -> s.chunk().indexedAt(), Comparator.reverseOrder())
            .thenComparing(s -> s.chunk().id());

    private final KnowledgeIndex index;
    private final EmbeddingModel embeddingModel;
    private final Cache<QueryKey, List<ScoredChunk>> results;

    public ContextRetriever(KnowledgeIndex index, EmbeddingModel embeddingModel) {
        this(index, embeddingModel, 0, Duration.ZERO);
    }

    /**
     * @param cacheSize maximum cached queries; 0 disables the cache
     * @param cacheTtl  how long a cached ranking stays valid
     */
    public ContextRetriever(KnowledgeIndex index, EmbeddingModel embeddingModel, long cacheSize, Duration cacheTtl) {
        this.index = Objects.requireNonNull(index, "index");
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        if (index.dimension() != embeddingModel.dimension()) {
            throw new IllegalArgumentException("Embedding model dimension " + embeddingModel.dimension()
                    + " does not match index dimension " + index.dimension());
        }
        this.results = cacheSize > 0 && cacheTtl.compareTo(Duration.ZERO) > 0
                ? Caffeine.newBuilder().maximumSize(cacheSize).expireAfterWrite(cacheTtl).build()
                : null;
    }

    public List<ScoredChunk> query(String text, int k) {
        return query(text, k, Set.of());
    }

    /**
     * Returns at most {@code k} chunks ranked by similarity to {@code text}.
     *
     * <p>When {@code requiredFeatures} is non-empty, only chunks flagging every feature are
     * kept. If none qualify the unfiltered ranking is returned.
     *
     * @return ranked chunks; empty for blank text, {@code k <= 0} or an empty index
     */
    public List<ScoredChunk> query(String text, int k, Set<String> requiredFeatures) {
        if (text == null || text.isBlank() || k <= 0) {
            return List.of();
        }
        if (results == null) {
            return rank(text, k, requiredFeatures);
        }
        Set<String> features = requiredFeatures == null ? Set.of() : new TreeSet<>(requiredFeatures);
        QueryKey key = new QueryKey(text, k, features, index.version());
        return results.get(key, ignored -> rank(text, k, features));
    }

    private List<ScoredChunk> rank(String text, int k, Set<String> requiredFeatures) {
        List<ContextChunk> snapshot = index.snapshot();
        if (snapshot.isEmpty()) {
            return List.of();
        }
        float[] q = embeddingModel.embed(text);
        List<ScoredChunk> ranked = snapshot.stream()
                .map(c -> new ScoredChunk(c, cosine(q, c.embedding())))
                .sorted(RANKING)
                .toList();

        if (requiredFeatures != null && !requiredFeatures.isEmpty()) {
            List<ScoredChunk> filtered = ranked.stream()
                    .filter(s -> requiredFeatures.stream().allMatch(f -> s.chunk().hasFeature(f)))
                    .toList();
            if (filtered.isEmpty()) {
                LOG.debug("No chunk has features {}; using unfiltered ranking", requiredFeatures);
            } else {
                ranked = filtered;
            }
        }
        return ranked.size() <= k ? ranked : List.copyOf(ranked.subList(0, k));
    }

    private record QueryKey(String text, int k, Set<String> features, long indexVersion) {}

    static double cosine(float[] a, float[] b) {
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
