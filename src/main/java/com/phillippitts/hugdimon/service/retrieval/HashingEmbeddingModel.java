package com.phillippitts.hugdimon.service.retrieval;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Local {@link EmbeddingModel} using signed feature hashing over word unigrams and bigrams,
 * L2-normalised. Texts sharing vocabulary get high cosine similarity; no network access
 * is needed.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    private final int dimension;

    public HashingEmbeddingModel(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] v = new float[dimension];
        if (text == null || text.isBlank()) {
            return v;
        }
        String[] tokens = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            accumulate(v, token, 1.0f);
            if (previous != null) {
                accumulate(v, previous + ' ' + token, 0.5f);
            }
            previous = token;
        }
        normalize(v);
        return v;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private void accumulate(float[] v, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long h = crc.getValue();
        int bucket = (int) (h % dimension);
        float sign = ((h >>> 31) & 1L) == 0 ? 1f : -1f;
        v[bucket] += sign * weight;
    }

    private static void normalize(float[] v) {
        double sum = 0;
        for (float x : v) {
            sum += x * x;
        }
        if (sum == 0) {
            return;
        }
        float norm = (float) Math.sqrt(sum);
        for (int i = 0; i < v.length; i++) {
            v[i] /= norm;
        }
    }
}
