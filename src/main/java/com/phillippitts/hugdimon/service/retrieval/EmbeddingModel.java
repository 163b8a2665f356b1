package com.phillippitts.hugdimon.service.retrieval;

/**
 * Maps text to a fixed-length vector. Implementations must be deterministic and thread-safe.
 */
public interface EmbeddingModel {

    /** @return embedding of length {@link #dimension()} */
    float[] embed(String text);

    int dimension();
}
