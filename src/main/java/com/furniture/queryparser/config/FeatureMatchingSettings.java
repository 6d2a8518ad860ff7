package com.furniture.queryparser.config;

import java.util.List;

/**
 * Tuning values for the fuzzy phrase lookup. Phrases containing one of {@code strictTerms}
 * produce many near misses and use the stricter threshold.
 */
public record FeatureMatchingSettings(
        int fuzzyMinLength,
        double defaultThreshold,
        double strictThreshold,
        List<String> strictTerms
) {
    public static final int DEFAULT_FUZZY_MIN_LENGTH = 6;
    public static final double DEFAULT_THRESHOLD = 0.93;
    public static final double STRICT_THRESHOLD = 0.96;
    public static final List<String> DEFAULT_STRICT_TERMS = List.of("detail", "metal");

    public FeatureMatchingSettings {
        strictTerms = strictTerms == null ? List.of() : List.copyOf(strictTerms);
    }

    public static FeatureMatchingSettings defaults() {
        return new FeatureMatchingSettings(DEFAULT_FUZZY_MIN_LENGTH, DEFAULT_THRESHOLD, STRICT_THRESHOLD, DEFAULT_STRICT_TERMS);
    }

    /**
     * Whether a phrase is long enough to be fuzzy matched at all.
     */
    public boolean isFuzzyCandidate(String phrase) {
        return phrase != null && phrase.length() > fuzzyMinLength;
    }

    public double thresholdFor(String phrase) {
        for (String term : strictTerms) {
            if (phrase.contains(term)) {
                return strictThreshold;
            }
        }
        return defaultThreshold;
    }
}
