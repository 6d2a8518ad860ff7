package com.furniture.queryparser.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.furniture.queryparser.model.ContextRule;
import com.furniture.queryparser.model.LexiconDefinition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lexicons shared by the service tests.
 */
final class TestLexicons {

    static final ContextRule LEATHER_RULE = new ContextRule("leather", 2, 2,
            List.of("sofa", "chair", "back", "seat", "arm", "cushion"));

    private TestLexicons() {
    }

    /**
     * The lexicon shipped with the application.
     */
    static FeatureLexicon bundled() {
        return FeatureLexicon.from(new LexiconLoader(new ObjectMapper()).load("lexicon/furniture-lexicon.json"));
    }

    /**
     * A handful of shapes, materials and details with the leather context rule.
     */
    static FeatureLexicon small() {
        Map<String, List<String>> features = new LinkedHashMap<>();
        features.put("Shape", List.of("l shape", "c shape"));
        features.put("Material", List.of("leather", "faux leather", "metal"));
        features.put("Detail", List.of("metal legs", "wooden legs"));
        return FeatureLexicon.from(new LexiconDefinition(features, null, null, List.of(LEATHER_RULE), null, null, null));
    }
}
