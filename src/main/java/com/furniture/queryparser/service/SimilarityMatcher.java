package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ScoredTerm;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Optional;

/**
 * Normalized string similarity based on matching blocks (Ratcliff/Obershelp).
 *
 * <p>The score is {@code 2 * M / (|a| + |b|)} where {@code M} is the number of characters
 * covered by the recursively found longest common substrings. Identical strings score 1.0,
 * strings with nothing in common score 0.0.
 */
@Component
public class SimilarityMatcher {

    public double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchingCharacters(a, b) / total;
    }

    /**
     * Returns the vocabulary term most similar to {@code phrase}. Ties go to the
     * lexicographically greater term so the result does not depend on iteration order.
     */
    public Optional<ScoredTerm> bestMatch(String phrase, Collection<String> vocabulary) {
        if (phrase == null || vocabulary == null || vocabulary.isEmpty()) {
            return Optional.empty();
        }
        ScoredTerm best = null;
        for (String term : vocabulary) {
            double score = similarity(term, phrase);
            if (best == null
                    || score > best.score()
                    || (score == best.score() && term.compareTo(best.term()) > 0)) {
                best = new ScoredTerm(term, score);
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Like {@link #bestMatch} but only returns a term that clears {@code threshold}.
     */
    public Optional<ScoredTerm> closestMatch(String phrase, Collection<String> vocabulary, double threshold) {
        return bestMatch(phrase, vocabulary).filter(candidate -> candidate.clears(threshold));
    }

    int matchingCharacters(String a, String b) {
        int matched = 0;
        Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            int[] range = pending.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];
            int[] block = longestMatch(a, b, alo, ahi, blo, bhi);
            int i = block[0], j = block[1], size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (alo < i && blo < j) {
                pending.push(new int[]{alo, i, blo, j});
            }
            if (i + size < ahi && j + size < bhi) {
                pending.push(new int[]{i + size, ahi, j + size, bhi});
            }
        }
        return matched;
    }

    // Longest common substring of a[alo, ahi) and b[blo, bhi); earliest in a wins, then earliest in b.
    private int[] longestMatch(String a, String b, int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;
        int width = bhi - blo + 1;
        int[] previous = new int[width];
        for (int i = alo; i < ahi; i++) {
            int[] current = new int[width];
            char c = a.charAt(i);
            for (int j = blo; j < bhi; j++) {
                if (c == b.charAt(j)) {
                    int k = previous[j - blo] + 1;
                    current[j - blo + 1] = k;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            previous = current;
        }
        return new int[]{bestI, bestJ, bestSize};
    }
}
