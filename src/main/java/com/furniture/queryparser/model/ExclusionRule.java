package com.furniture.queryparser.model;

/**
 * Two features that cannot both survive. The surviving one is chosen by which signal
 * substring appears in the lowercased query.
 */
public record ExclusionRule(String featureA, String signalA, String featureB, String signalB) {
}
