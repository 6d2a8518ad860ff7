package com.furniture.queryparser.service;

import com.furniture.queryparser.config.FeatureMatchingSettings;
import com.furniture.queryparser.model.FeatureMatch;
import com.furniture.queryparser.model.MatchKind;
import com.furniture.queryparser.model.ScoredTerm;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WindowedFeatureMatcherTest {

    private FeatureLexicon lexicon;
    private WindowedFeatureMatcher matcher;

    @BeforeEach
    void setUp() {
        lexicon = TestLexicons.small();
        matcher = newMatcher(new SimilarityMatcher());
    }

    @Test
    void prefersLongestWindowOverItsSubPhrases() {
        List<FeatureMatch> matches = matcher.scan("l shape sofa with metal legs");

        assertThat(matches).extracting(FeatureMatch::feature).containsExactly("l shape", "metal legs");
        assertThat(matches).extracting(FeatureMatch::size).containsExactly(2, 2);
        assertThat(matcher.extract("l shape sofa with metal legs")).doesNotContain("metal");
    }

    @Test
    void acceptedWindowsNeverShareTokens() {
        List<String> inputs = List.of(
                "l shape sofa with metal legs",
                "metal legs metal legs and metal",
                "faux leather sofa with wooden legs and metal legs",
                "c shape l shape leather cushion metal");

        for (String input : inputs) {
            List<FeatureMatch> matches = matcher.scan(input);
            for (int i = 0; i < matches.size(); i++) {
                for (int j = i + 1; j < matches.size(); j++) {
                    assertThat(matches.get(i).overlaps(matches.get(j)))
                            .as("%s overlaps %s in '%s'", matches.get(i), matches.get(j), input)
                            .isFalse();
                }
            }
        }
    }

    @Test
    void repeatedExtractionGivesSameResult() {
        String text = "faux leather sofa with wooden legs and metal legs";

        List<String> first = matcher.extract(text);
        List<String> second = matcher.extract(text);

        assertThat(second).isEqualTo(first);
        assertThat(first).containsExactly("faux leather", "wooden legs", "metal legs");
    }

    @Test
    void emptyTextYieldsNoFeatures() {
        assertThat(matcher.extract("")).isEmpty();
        assertThat(matcher.extract("   ")).isEmpty();
        assertThat(matcher.extract(null)).isEmpty();
    }

    @Test
    void leatherNeedsFurniturePartNearby() {
        assertThat(matcher.extract("leather wallet")).isEmpty();
        assertThat(matcher.extract("leather sofa cushion")).containsExactly("leather");
    }

    @Test
    void rejectedWindowLeavesTokensForShorterWindows() {
        // "faux leather" starts too far from "sofa"; "leather" alone is close enough
        List<FeatureMatch> matches = matcher.scan("faux leather for sofa");

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).feature()).isEqualTo("leather");
        assertThat(matches.get(0).start()).isEqualTo(1);
    }

    @Test
    void featureIsReportedOnce() {
        List<FeatureMatch> matches = matcher.scan("leather sofa and leather chair");

        assertThat(matches).extracting(FeatureMatch::feature).containsExactly("leather");
    }

    @Test
    void fuzzyMatchesLongPhrases() {
        List<FeatureMatch> matches = matcher.scan("wooden legss");

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).feature()).isEqualTo("wooden legs");
        assertThat(matches.get(0).kind()).isEqualTo(MatchKind.FUZZY);
    }

    @Test
    void metalPhrasesNeedTheStricterThreshold() {
        // 20/21 similarity clears 0.93 but not 0.96, so only the exact single word remains
        assertThat(matcher.extract("metal legss")).containsExactly("metal");
    }

    @Test
    void thresholdDependsOnStrictTerm() {
        SimilarityMatcher similarity = mock(SimilarityMatcher.class);
        when(similarity.bestMatch(eq("metal legz"), any())).thenReturn(Optional.of(new ScoredTerm("wooden legs", 0.94)));
        when(similarity.bestMatch(eq("steel legz"), any())).thenReturn(Optional.of(new ScoredTerm("wooden legs", 0.94)));
        WindowedFeatureMatcher stubbed = newMatcher(similarity);

        assertThat(stubbed.extract("metal legz")).doesNotContain("wooden legs");
        assertThat(stubbed.extract("steel legz")).containsExactly("wooden legs");
    }

    @Test
    void shortPhrasesAreNeverFuzzyMatched() {
        SimilarityMatcher similarity = mock(SimilarityMatcher.class);
        WindowedFeatureMatcher stubbed = newMatcher(similarity);

        assertThat(stubbed.extract("metl")).isEmpty();
    }

    private WindowedFeatureMatcher newMatcher(SimilarityMatcher similarityMatcher) {
        return new WindowedFeatureMatcher(lexicon, similarityMatcher, new ContextualAcceptance(lexicon),
                FeatureMatchingSettings.defaults());
    }
}
