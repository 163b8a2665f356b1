package com.phillippitts.hugdimon.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for context retrieval and the bundled knowledge catalog.
 */
@Validated
@ConfigurationProperties(prefix = "hugdimon.retrieval")
public class RetrievalProperties {

    /** Number of chunks fetched per turn. */
    @Min(0)
    private final int topK;

    /** Dimension of the embeddings produced by the local embedding model. */
    @Positive
    private final int embeddingDimension;

    /** Resource location of the catalog ingested at startup. */
    @NotBlank
    private final String catalogLocation;

    /** Maximum number of cached query rankings; 0 disables the cache. */
    @Min(0)
    private final long queryCacheSize;

    @NotNull
    private final Duration queryCacheTtl;

    /** Places scoring below this similarity are not listed by the guide. */
    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private final double guideMinScore;

    public RetrievalProperties(Integer topK, Integer embeddingDimension, String catalogLocation) {
        this(topK, embeddingDimension, catalogLocation, null, null, null);
    }

    @ConstructorBinding
    public RetrievalProperties(Integer topK,
                               Integer embeddingDimension,
                               String catalogLocation,
                               Long queryCacheSize,
                               Duration queryCacheTtl,
                               Double guideMinScore) {
        this.topK = topK == null ? 5 : topK;
        this.embeddingDimension = embeddingDimension == null ? 256 : embeddingDimension;
        this.catalogLocation = catalogLocation == null ? "classpath:knowledge/catalog.json" : catalogLocation;
        this.queryCacheSize = queryCacheSize == null ? 200 : queryCacheSize;
        this.queryCacheTtl = queryCacheTtl == null ? Duration.ofMinutes(30) : queryCacheTtl;
        this.guideMinScore = guideMinScore == null ? 0.1 : guideMinScore;
    }

    public int getTopK() {
        return topK;
    }

    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    public String getCatalogLocation() {
        return catalogLocation;
    }

    public long getQueryCacheSize() {
        return queryCacheSize;
    }

    public Duration getQueryCacheTtl() {
        return queryCacheTtl;
    }

    public double getGuideMinScore() {
        return guideMinScore;
    }
}
