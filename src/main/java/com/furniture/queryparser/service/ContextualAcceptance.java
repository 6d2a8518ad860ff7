package com.furniture.queryparser.service;

import com.furniture.queryparser.model.ContextRule;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a matched phrase is supported by the tokens around it.
 *
 * <p>Only phrases covered by a {@link ContextRule} are checked; every other candidate is accepted.
 * When several rules apply, all of them must be satisfied.
 */
@Component
public class ContextualAcceptance {

    private final List<ContextRule> rules;

    @Autowired
    public ContextualAcceptance(FeatureLexicon lexicon) {
        this(lexicon.contextRules());
    }

    ContextualAcceptance(List<ContextRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public boolean accepts(String phrase, List<String> tokens, int start) {
        for (ContextRule rule : rules) {
            if (phrase.contains(rule.trigger()) && !hasRequiredTerm(rule, tokens, start)) {
                return false;
            }
        }
        return true;
    }

    private boolean hasRequiredTerm(ContextRule rule, List<String> tokens, int start) {
        int from = Math.max(0, start - rule.before());
        int to = Math.min(tokens.size(), start + rule.after() + 1);
        String context = String.join(" ", tokens.subList(from, to));
        for (String term : rule.requiredTerms()) {
            if (context.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
