package com.furniture.queryparser.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class FeatureExtractionService {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractionService.class);

    private final WindowedFeatureMatcher windowedFeatureMatcher;
    private final ContextualPatternMatcher contextualPatternMatcher;
    private final FeatureDisambiguator featureDisambiguator;

    public FeatureExtractionService(WindowedFeatureMatcher windowedFeatureMatcher,
                                    ContextualPatternMatcher contextualPatternMatcher,
                                    FeatureDisambiguator featureDisambiguator) {
        this.windowedFeatureMatcher = windowedFeatureMatcher;
        this.contextualPatternMatcher = contextualPatternMatcher;
        this.featureDisambiguator = featureDisambiguator;
    }

    /**
     * Window scan features first, then pattern features not already found, then exclusions.
     */
    public List<String> extractFeatures(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = text.toLowerCase(Locale.ROOT).trim();
        Set<String> features = new LinkedHashSet<>(windowedFeatureMatcher.extract(normalized));
        features.addAll(contextualPatternMatcher.extractFromPatterns(text));
        List<String> resolved = featureDisambiguator.disambiguate(new ArrayList<>(features), normalized);
        log.debug("Extracted features {} from '{}'", resolved, text);
        return resolved;
    }
}
