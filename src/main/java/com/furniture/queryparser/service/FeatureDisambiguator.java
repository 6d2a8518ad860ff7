package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ExclusionRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Removes one feature of each mutually exclusive pair, based on which signal the query carries.
 * When both signals or neither are present the pair is left as is.
 */
@Component
public class FeatureDisambiguator {

    private static final Logger log = LoggerFactory.getLogger(FeatureDisambiguator.class);

    private final List<ExclusionRule> rules;

    @Autowired
    public FeatureDisambiguator(FeatureLexicon lexicon) {
        this(lexicon.exclusionRules());
    }

    FeatureDisambiguator(List<ExclusionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<String> disambiguate(List<String> features, String text) {
        List<String> result = new ArrayList<>(features);
        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (ExclusionRule rule : rules) {
            if (!result.contains(rule.featureA()) || !result.contains(rule.featureB())) {
                continue;
            }
            boolean hasA = lower.contains(rule.signalA());
            boolean hasB = lower.contains(rule.signalB());
            if (hasA && !hasB) {
                result.remove(rule.featureB());
                log.debug("Dropped '{}' in favour of '{}'", rule.featureB(), rule.featureA());
            } else if (hasB && !hasA) {
                result.remove(rule.featureA());
                log.debug("Dropped '{}' in favour of '{}'", rule.featureA(), rule.featureB());
            }
        }
        return result;
    }
}
