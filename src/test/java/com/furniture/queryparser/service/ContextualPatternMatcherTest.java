package com.furniture.queryparser.service;

import com.furniture.queryparser.model.CorrectionRule;
import com.furniture.queryparser.model.LexiconDefinition;
import com.furniture.queryparser.model.PatternRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextualPatternMatcherTest {

    private final ContextualPatternMatcher matcher = new ContextualPatternMatcher(TestLexicons.bundled());

    @Test
    void directPatternsAreCaseInsensitive() {
        assertThat(matcher.extractFromPatterns("L-Shaped couch")).containsExactly("l shape");
        assertThat(matcher.extractFromPatterns("Sofa with a pull-out bed")).containsExactly("pull out bed");
    }

    @Test
    void correctsMisspellingBeforeRetesting() {
        assertThat(matcher.extractFromPatterns("faux leathr armchair")).containsExactly("leather");
    }

    @Test
    void directMatchesComeBeforeCorrectedOnes() {
        assertThat(matcher.extractFromPatterns("faux leathr sofa with storage"))
                .containsExactly("storage", "leather");
    }

    @Test
    void correctsEachOccurrenceSeparately() {
        FeatureLexicon lexicon = FeatureLexicon.from(new LexiconDefinition(
                Map.of("Material", List.of("velvet", "linen")),
                List.of(new PatternRule("\\bblue velvet\\b", "velvet"), new PatternRule("\\bwhite velvet\\b", "linen")),
                List.of(new CorrectionRule("\\bvelvit\\b", "velvet")),
                null, null, null, null));
        ContextualPatternMatcher custom = new ContextualPatternMatcher(lexicon);

        assertThat(custom.extractFromPatterns("blue velvit chair, white velvit pouf"))
                .containsExactly("velvet", "linen");
    }

    @Test
    void ignoresTargetsOutsideTheLexicon() {
        FeatureLexicon lexicon = FeatureLexicon.from(new LexiconDefinition(
                Map.of("Material", List.of("velvet")),
                List.of(new PatternRule("\\bplush\\b", "mohair"), new PatternRule("\\bplush\\b", "Velvet")),
                null, null, null, null, null));

        assertThat(new ContextualPatternMatcher(lexicon).extractFromPatterns("plush sofa")).containsExactly("velvet");
    }

    @Test
    void emptyTextYieldsNothing() {
        assertThat(matcher.extractFromPatterns("")).isEmpty();
        assertThat(matcher.extractFromPatterns(null)).isEmpty();
    }
}
