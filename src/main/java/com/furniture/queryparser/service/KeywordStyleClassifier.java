package com.furniture.queryparser.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reports the lexicon styles named in a query, as whole words, in lexicon order.
 */
@Service
public class KeywordStyleClassifier implements StyleClassificationExtractor {

    private final Map<String, Pattern> patternByStyle = new LinkedHashMap<>();

    public KeywordStyleClassifier(FeatureLexicon lexicon) {
        for (String style : lexicon.styles()) {
            String lower = style.toLowerCase(Locale.ROOT);
            patternByStyle.put(style, Pattern.compile("(?<![\\w-])" + Pattern.quote(lower) + "(?![\\w-])"));
        }
    }

    @Override
    public Map<String, Object> extractClassification(String query) {
        List<String> styles = new ArrayList<>();
        if (query != null) {
            String lower = query.toLowerCase(Locale.ROOT);
            patternByStyle.forEach((style, pattern) -> {
                if (pattern.matcher(lower).find()) {
                    styles.add(style);
                }
            });
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("styles", styles);
        summary.put("primary_style", styles.isEmpty() ? null : styles.get(0));
        summary.put("confidence", styles.isEmpty() ? 0.0 : 1.0);
        return summary;
    }
}
