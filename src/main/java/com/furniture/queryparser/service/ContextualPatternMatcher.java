package com.furniture.queryparser.service;

import com.furniture.queryparser.model.CorrectionRule;
import com.furniture.queryparser.model.PatternRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex pass that catches phrasings the window scan misses ("pull-out bed", "faux leathr").
 *
 * <p>Direct patterns run first. Then every match of a misspelling pattern is corrected in a
 * copy of the text and the direct patterns are tested again on that copy. Matching is
 * case-insensitive and independent of the window scan.
 */
@Component
public class ContextualPatternMatcher {

    private final FeatureLexicon lexicon;
    private final List<CompiledRule> directRules;
    private final List<CompiledCorrection> corrections;

    public ContextualPatternMatcher(FeatureLexicon lexicon) {
        this.lexicon = lexicon;
        this.directRules = new ArrayList<>();
        for (PatternRule rule : lexicon.patternRules()) {
            directRules.add(new CompiledRule(compile(rule.pattern()), rule.feature().toLowerCase(Locale.ROOT)));
        }
        this.corrections = new ArrayList<>();
        for (CorrectionRule rule : lexicon.correctionRules()) {
            corrections.add(new CompiledCorrection(compile(rule.pattern()), rule.correction()));
        }
    }

    public List<String> extractFromPatterns(String text) {
        List<String> detected = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return detected;
        }
        applyDirectRules(text, detected);
        for (CompiledCorrection correction : corrections) {
            Matcher matcher = correction.pattern().matcher(text);
            while (matcher.find()) {
                String corrected = text.substring(0, matcher.start())
                        + correction.replacement()
                        + text.substring(matcher.end());
                applyDirectRules(corrected, detected);
            }
        }
        return detected;
    }

    private void applyDirectRules(String text, List<String> detected) {
        for (CompiledRule rule : directRules) {
            if (rule.pattern().matcher(text).find()
                    && lexicon.contains(rule.feature())
                    && !detected.contains(rule.feature())) {
                detected.add(rule.feature());
            }
        }
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record CompiledRule(Pattern pattern, String feature) {
    }

    private record CompiledCorrection(Pattern pattern, String replacement) {
    }
}
