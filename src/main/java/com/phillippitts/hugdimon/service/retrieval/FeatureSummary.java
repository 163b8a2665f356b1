package com.phillippitts.hugdimon.service.retrieval;

import com.phillippitts.hugdimon.domain.ScoredChunk;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One-line note telling the model how many retrieved places offer the features the user asked
 * for, e.g. "There are 3 places with a terrace and a sea view in Cadaqués."
 */
public final class FeatureSummary {

    private static final Map<String, String> PHRASES = Map.of(
            FeatureKeywordExtractor.HAS_TERRACE, "a terrace",
            FeatureKeywordExtractor.SEA_VIEW, "a sea view",
            FeatureKeywordExtractor.BOOKING, "booking available");

    private static final List<String> ORDER = List.of(
            FeatureKeywordExtractor.HAS_TERRACE, FeatureKeywordExtractor.SEA_VIEW, FeatureKeywordExtractor.BOOKING);

    private FeatureSummary() {
    }

    /**
     * @return the note, or null when no feature was requested or no retrieved place has them all
     */
    public static String describe(Set<String> features, List<ScoredChunk> chunks) {
        if (features == null || features.isEmpty() || chunks == null) {
            return null;
        }
        long count = chunks.stream()
                .filter(s -> features.stream().allMatch(f -> s.chunk().hasFeature(f)))
                .count();
        if (count == 0) {
            return null;
        }
        String wanted = ORDER.stream()
                .filter(features::contains)
                .map(PHRASES::get)
                .collect(Collectors.joining(" and "));
        return count == 1
                ? "There is 1 place with " + wanted + " in Cadaqués."
                : "There are " + count + " places with " + wanted + " in Cadaqués.";
    }
}
