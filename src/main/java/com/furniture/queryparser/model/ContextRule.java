package com.furniture.queryparser.model;

import java.util.List;

/**
 * Context guard for an ambiguous feature family: a phrase containing {@code trigger} is only
 * accepted when one of {@code requiredTerms} occurs within {@code before} tokens before and
 * {@code after} tokens after the phrase start.
 */
public record ContextRule(String trigger, int before, int after, List<String> requiredTerms) {

    public List<String> requiredTerms() {
        return requiredTerms == null ? List.of() : requiredTerms;
    }
}
