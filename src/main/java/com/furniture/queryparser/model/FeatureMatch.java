package com.furniture.queryparser.model;

/**
 * A window accepted by the phrase scan. {@code end} is exclusive.
 */
public record FeatureMatch(String feature, String phrase, int start, int end, MatchKind kind) {

    public int size() {
        return end - start;
    }

    public boolean overlaps(FeatureMatch other) {
        return start < other.end && other.start < end;
    }
}
