package com.furniture.queryparser.model;

/**
 * Vocabulary term paired with its similarity to a probe phrase, in {@code [0, 1]}.
 */
public record ScoredTerm(String term, double score) {

    public boolean clears(double threshold) {
        return score >= threshold;
    }
}
