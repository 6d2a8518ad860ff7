package com.furniture.queryparser.service;

import com.furniture.queryparser.config.FeatureMatchingSettings;
import com.furniture.queryparser.model.FeatureMatch;
import com.furniture.queryparser.model.MatchKind;
import com.furniture.queryparser.model.ScoredTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy longest-phrase-first feature matcher.
 *
 * <p>Windows of 4, 3, 2 and 1 tokens are tried in that order, left to right. A window is looked
 * up exactly first and fuzzily second; an accepted window consumes its tokens so no shorter
 * window can reuse them. All scan state is allocated per call.
 */
@Component
public class WindowedFeatureMatcher {

    private static final Logger log = LoggerFactory.getLogger(WindowedFeatureMatcher.class);

    static final int[] WINDOW_SIZES = {4, 3, 2, 1};

    private final FeatureLexicon lexicon;
    private final SimilarityMatcher similarityMatcher;
    private final ContextualAcceptance contextualAcceptance;
    private final FeatureMatchingSettings settings;

    public WindowedFeatureMatcher(FeatureLexicon lexicon,
                                  SimilarityMatcher similarityMatcher,
                                  ContextualAcceptance contextualAcceptance,
                                  FeatureMatchingSettings settings) {
        this.lexicon = lexicon;
        this.similarityMatcher = similarityMatcher;
        this.contextualAcceptance = contextualAcceptance;
        this.settings = settings;
    }

    /**
     * Extracts canonical features in acceptance order.
     */
    public List<String> extract(String text) {
        List<FeatureMatch> matches = scan(text);
        List<String> features = new ArrayList<>(matches.size());
        for (FeatureMatch match : matches) {
            features.add(match.feature());
        }
        return features;
    }

    /**
     * Runs the window scan and returns every accepted window.
     */
    public List<FeatureMatch> scan(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = Arrays.asList(text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
        int tokenCount = tokens.size();
        BitSet consumed = new BitSet(tokenCount);
        Set<String> detected = new LinkedHashSet<>();
        List<FeatureMatch> accepted = new ArrayList<>();

        log.debug("Scanning '{}' ({} tokens)", text, tokenCount);
        for (int size : WINDOW_SIZES) {
            for (int start = 0; start + size <= tokenCount; start++) {
                int end = start + size;
                if (!consumed.get(start, end).isEmpty()) {
                    continue;
                }
                String phrase = String.join(" ", tokens.subList(start, end));
                Optional<FeatureMatch> candidate = resolve(phrase, start, end);
                if (candidate.isEmpty()) {
                    continue;
                }
                FeatureMatch match = candidate.get();
                if (!contextualAcceptance.accepts(phrase, tokens, start)) {
                    log.debug("  '{}' -> {} rejected by context", phrase, match.feature());
                    continue;
                }
                if (detected.add(match.feature())) {
                    consumed.set(start, end);
                    accepted.add(match);
                    log.debug("  {} match '{}' -> {} [{}, {})", match.kind(), phrase, match.feature(), start, end);
                }
            }
        }
        log.debug("Features for '{}': {}", text, detected);
        return accepted;
    }

    private Optional<FeatureMatch> resolve(String phrase, int start, int end) {
        Optional<String> exact = lexicon.canonicalOf(phrase);
        if (exact.isPresent()) {
            return Optional.of(new FeatureMatch(exact.get(), phrase, start, end, MatchKind.EXACT));
        }
        if (!settings.isFuzzyCandidate(phrase)) {
            return Optional.empty();
        }
        double threshold = settings.thresholdFor(phrase);
        Optional<ScoredTerm> best = similarityMatcher.bestMatch(phrase, lexicon.vocabulary());
        if (best.isEmpty() || !best.get().clears(threshold)) {
            return Optional.empty();
        }
        return lexicon.canonicalOf(best.get().term())
                .map(feature -> new FeatureMatch(feature, phrase, start, end, MatchKind.FUZZY));
    }
}
