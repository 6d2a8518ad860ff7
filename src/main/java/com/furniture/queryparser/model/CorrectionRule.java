package com.furniture.queryparser.model;

/**
 * Misspelling pattern and the word that replaces it before the pattern rules are re-tested.
 */
public record CorrectionRule(String pattern, String correction) {
}
