package com.phillippitts.hugdimon.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * One retrievable unit of background knowledge with its vector embedding.
 *
 * <p>Immutable: the embedding is defensively copied on the way in and out.
 *
 * @param id        unique chunk id
 * @param sourceId  id of the document the chunk was cut from
 * @param text      chunk text
 * @param embedding fixed-length vector
 * @param metadata  free-form metadata (e.g. {@code name}, {@code category}, {@code features})
 * @param indexedAt when the chunk was indexed; newer chunks win score ties
 */
public record ContextChunk(
        String id,
        String sourceId,
        String text,
        float[] embedding,
        Map<String, Object> metadata,
        Instant indexedAt
) {

    public ContextChunk {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(embedding, "embedding must not be null");
        Objects.requireNonNull(indexedAt, "indexedAt must not be null");
        if (embedding.length == 0) {
            throw new IllegalArgumentException("embedding must not be empty");
        }
        embedding = embedding.clone();
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    /** @return embedding dimension */
    public int dimension() {
        return embedding.length;
    }

    /**
     * Reads a boolean feature flag from the {@code features} metadata map.
     *
     * @param feature feature name such as {@code has_terrace}
     * @return true only when the flag is present and true
     */
    public boolean hasFeature(String feature) {
        Object features = metadata.get("features");
        if (features instanceof Map<?, ?> map) {
            return Boolean.TRUE.equals(map.get(feature));
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ContextChunk other)) {
            return false;
        }
        return id.equals(other.id)
                && sourceId.equals(other.sourceId)
                && text.equals(other.text)
                && Arrays.equals(embedding, other.embedding)
                && metadata.equals(other.metadata)
                && indexedAt.equals(other.indexedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sourceId, text, Arrays.hashCode(embedding), metadata, indexedAt);
    }

    @Override
    public String toString() {
        return "ContextChunk{id=" + id + ", sourceId=" + sourceId + ", dim=" + embedding.length + '}';
    }
}
