package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ProductTypeClassification;
import com.furniture.queryparser.model.ScoredTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises product types from the synonym lists in the lexicon.
 *
 * <p>Two-word synonyms are tried before single words. A single word of at least four
 * characters that matches nothing exactly is compared against every synonym; a close enough
 * hit is counted and rewritten in the corrected query.
 */
@Service
public class DictionaryProductTypeClassifier implements ProductTypeClassifier {

    private static final Logger log = LoggerFactory.getLogger(DictionaryProductTypeClassifier.class);

    private static final int MIN_CORRECTABLE_LENGTH = 4;

    private final SimilarityMatcher similarityMatcher;
    private final double fuzzyThreshold;
    private final Map<String, String> typeBySynonym = new LinkedHashMap<>();

    public DictionaryProductTypeClassifier(FeatureLexicon lexicon,
                                           SimilarityMatcher similarityMatcher,
                                           @Value("${parser.product-type.fuzzy-threshold:0.8}") double fuzzyThreshold) {
        this.similarityMatcher = similarityMatcher;
        this.fuzzyThreshold = fuzzyThreshold;
        lexicon.productTypes().forEach((type, synonyms) -> {
            typeBySynonym.putIfAbsent(type.toLowerCase(Locale.ROOT), type);
            synonyms.forEach(synonym -> typeBySynonym.putIfAbsent(synonym.toLowerCase(Locale.ROOT), type));
        });
    }

    @Override
    public ProductTypeClassification classifyProductType(String query) {
        if (query == null || query.isBlank()) {
            return ProductTypeClassification.unknown(query);
        }
        String[] tokens = query.toLowerCase(Locale.ROOT).trim().split("\\s+");
        Map<String, Double> confidenceByType = new LinkedHashMap<>();
        boolean corrected = false;

        int i = 0;
        while (i < tokens.length) {
            if (i + 1 < tokens.length) {
                String type = typeBySynonym.get(tokens[i] + " " + tokens[i + 1]);
                if (type != null) {
                    confidenceByType.merge(type, 1.0, Math::max);
                    i += 2;
                    continue;
                }
            }
            String type = typeBySynonym.get(tokens[i]);
            if (type != null) {
                confidenceByType.merge(type, 1.0, Math::max);
            } else if (tokens[i].length() >= MIN_CORRECTABLE_LENGTH) {
                Optional<ScoredTerm> hit = similarityMatcher.closestMatch(tokens[i], typeBySynonym.keySet(), fuzzyThreshold);
                if (hit.isPresent()) {
                    log.debug("Corrected '{}' to '{}' ({})", tokens[i], hit.get().term(), hit.get().score());
                    confidenceByType.merge(typeBySynonym.get(hit.get().term()), hit.get().score(), Math::max);
                    tokens[i] = hit.get().term();
                    corrected = true;
                }
            }
            i++;
        }

        String correctedQuery = corrected ? String.join(" ", tokens) : query;
        if (confidenceByType.isEmpty()) {
            return ProductTypeClassification.unknown(correctedQuery);
        }
        return new ProductTypeClassification(
                new ArrayList<>(confidenceByType.keySet()),
                new ArrayList<>(confidenceByType.values()),
                correctedQuery);
    }
}
