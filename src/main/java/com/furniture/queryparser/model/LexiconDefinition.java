package com.furniture.queryparser.model;

import java.util.List;
import java.util.Map;

/**
 * Raw shape of the lexicon resource, as read by Jackson.
 */
public record LexiconDefinition(
        Map<String, List<String>> features,
        List<PatternRule> contextualPatterns,
        List<CorrectionRule> fuzzyPatterns,
        List<ContextRule> contextRules,
        List<ExclusionRule> exclusionRules,
        Map<String, List<String>> productTypes,
        List<String> styles
) {
    public Map<String, List<String>> features() {
        return features == null ? Map.of() : features;
    }

    public List<PatternRule> contextualPatterns() {
        return contextualPatterns == null ? List.of() : contextualPatterns;
    }

    public List<CorrectionRule> fuzzyPatterns() {
        return fuzzyPatterns == null ? List.of() : fuzzyPatterns;
    }

    public List<ContextRule> contextRules() {
        return contextRules == null ? List.of() : contextRules;
    }

    public List<ExclusionRule> exclusionRules() {
        return exclusionRules == null ? List.of() : exclusionRules;
    }

    public Map<String, List<String>> productTypes() {
        return productTypes == null ? Map.of() : productTypes;
    }

    public List<String> styles() {
        return styles == null ? List.of() : styles;
    }
}
