package com.furniture.queryparser.model;

/**
 * Regular expression that implies a feature when it matches the query.
 */
public record PatternRule(String pattern, String feature) {
}
