package com.phillippitts.hugdimon.domain;

import java.util.Objects;

/**
 * A context chunk together with its similarity to a query.
 *
 * @param chunk the retrieved chunk
 * @param score cosine similarity in [-1, 1]
 */
public record ScoredChunk(ContextChunk chunk, double score) {

    public ScoredChunk {
        Objects.requireNonNull(chunk, "chunk must not be null");
    }
}
