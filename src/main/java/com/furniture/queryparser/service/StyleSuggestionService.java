package com.furniture.queryparser.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Service
public class StyleSuggestionService {

    private final FeatureLexicon lexicon;
    private final int limit;

    public StyleSuggestionService(FeatureLexicon lexicon,
                                  @Value("${parser.suggestion.limit:10}") int limit) {
        this.lexicon = lexicon;
        this.limit = limit;
    }

    /**
     * Styles starting with {@code prefix} (case-insensitive), title-cased, in lexicon order.
     */
    public List<String> suggestStyles(String prefix) {
        List<String> matches = new ArrayList<>();
        if (prefix == null) {
            return matches;
        }
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT).trim();
        for (String style : lexicon.styles()) {
            if (matches.size() >= limit) {
                break;
            }
            if (style.toLowerCase(Locale.ROOT).startsWith(lowerPrefix)) {
                matches.add(titleCase(style));
            }
        }
        return matches;
    }

    static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
