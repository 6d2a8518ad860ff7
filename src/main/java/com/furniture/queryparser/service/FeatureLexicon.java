package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ContextRule;
import com.furniture.queryparser.model.CorrectionRule;
import com.furniture.queryparser.model.ExclusionRule;
import com.furniture.queryparser.model.LexiconDefinition;
import com.furniture.queryparser.model.PatternRule;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable dictionary of canonical furniture features and the rule tables that go with them.
 *
 * <p>Every canonical feature belongs to exactly one category. Lookups are case-insensitive.
 * Instances are built once at startup and are safe to share between any number of threads.
 */
public final class FeatureLexicon {

    public static final String DEFAULT_CATEGORY = "Other";

    private final ImmutableMap<String, String> canonicalByKey;
    private final ImmutableMap<String, String> categoryByFeature;
    private final ImmutableList<PatternRule> patternRules;
    private final ImmutableList<CorrectionRule> correctionRules;
    private final ImmutableList<ContextRule> contextRules;
    private final ImmutableList<ExclusionRule> exclusionRules;
    private final ImmutableMap<String, ImmutableList<String>> productTypes;
    private final ImmutableList<String> styles;

    private FeatureLexicon(ImmutableMap<String, String> canonicalByKey,
                           ImmutableMap<String, String> categoryByFeature,
                           LexiconDefinition definition) {
        this.canonicalByKey = canonicalByKey;
        this.categoryByFeature = categoryByFeature;
        this.patternRules = ImmutableList.copyOf(definition.contextualPatterns());
        this.correctionRules = ImmutableList.copyOf(definition.fuzzyPatterns());
        this.contextRules = ImmutableList.copyOf(definition.contextRules());
        this.exclusionRules = ImmutableList.copyOf(definition.exclusionRules());
        ImmutableMap.Builder<String, ImmutableList<String>> types = ImmutableMap.builder();
        definition.productTypes().forEach((type, synonyms) ->
                types.put(type, synonyms == null ? ImmutableList.of() : ImmutableList.copyOf(synonyms)));
        this.productTypes = types.build();
        this.styles = ImmutableList.copyOf(definition.styles());
    }

    /**
     * Builds the lexicon from its raw definition.
     *
     * @throws LexiconLoadException if a feature is listed under more than one category
     */
    public static FeatureLexicon from(LexiconDefinition definition) {
        Map<String, String> canonicalByKey = new LinkedHashMap<>();
        Map<String, String> categoryByFeature = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : definition.features().entrySet()) {
            String category = entry.getKey() == null || entry.getKey().isBlank() ? DEFAULT_CATEGORY : entry.getKey();
            if (entry.getValue() == null) {
                continue;
            }
            for (String feature : entry.getValue()) {
                if (feature == null || feature.isBlank()) {
                    continue;
                }
                String canonical = feature.trim();
                String previous = categoryByFeature.putIfAbsent(canonical, category);
                if (previous != null && !previous.equals(category)) {
                    throw new LexiconLoadException("Feature '" + canonical + "' is mapped to both "
                            + previous + " and " + category);
                }
                canonicalByKey.putIfAbsent(key(canonical), canonical);
            }
        }
        return new FeatureLexicon(ImmutableMap.copyOf(canonicalByKey), ImmutableMap.copyOf(categoryByFeature), definition);
    }

    /**
     * Convenience factory for a lexicon with features only and no rule tables.
     */
    public static FeatureLexicon ofFeatures(Map<String, List<String>> featuresByCategory) {
        return from(new LexiconDefinition(featuresByCategory, null, null, null, null, null, null));
    }

    public Optional<String> canonicalOf(String phrase) {
        if (phrase == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByKey.get(key(phrase)));
    }

    public boolean contains(String phrase) {
        return canonicalOf(phrase).isPresent();
    }

    public String categoryOf(String feature) {
        return canonicalOf(feature).map(categoryByFeature::get).orElse(DEFAULT_CATEGORY);
    }

    /**
     * Lowercased forms of every canonical feature, the vocabulary for fuzzy lookup.
     */
    public ImmutableSet<String> vocabulary() {
        return canonicalByKey.keySet();
    }

    public int size() {
        return canonicalByKey.size();
    }

    public List<PatternRule> patternRules() {
        return patternRules;
    }

    public List<CorrectionRule> correctionRules() {
        return correctionRules;
    }

    public List<ContextRule> contextRules() {
        return contextRules;
    }

    public List<ExclusionRule> exclusionRules() {
        return exclusionRules;
    }

    public Map<String, ImmutableList<String>> productTypes() {
        return productTypes;
    }

    public List<String> styles() {
        return styles;
    }

    private static String key(String phrase) {
        return phrase.trim().toLowerCase(Locale.ROOT);
    }
}
