package com.furniture.queryparser.service;

import com.furniture.queryparser.model.PriceRange;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class RegexPriceRangeExtractor implements PriceRangeExtractor {

    private static final double RANGE_CONFIDENCE = 0.9;
    private static final double BOUND_CONFIDENCE = 0.8;

    private static final String NUMBER = "(?:\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:[.,]\\d+)?)";
    // Bare spans need two digits so "3-4 seater" is not read as a price
    private static final String WIDE_NUMBER = "(?:\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d{2,}(?:[.,]\\d+)?)";
    private static final String AMOUNT = "([€$£]?\\s*" + NUMBER + "(?:k\\b)?)";
    private static final String WIDE_AMOUNT = "([€$£]?\\s*" + WIDE_NUMBER + "(?:k\\b)?)";
    private static final Pattern THOUSANDS = Pattern.compile("\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?");

    private static final Pattern BETWEEN = Pattern.compile(
            "\\bbetween\\s+" + AMOUNT + "\\s*(?:and|-|to)\\s*" + AMOUNT, Pattern.CASE_INSENSITIVE);
    private static final Pattern SPAN = Pattern.compile(
            WIDE_AMOUNT + "\\s*(?:-|to)\\s*" + WIDE_AMOUNT, Pattern.CASE_INSENSITIVE);
    private static final Pattern UPPER = Pattern.compile(
            "\\b(?:under|below|less than|up to|max(?:imum)?|cheaper than)\\s+" + AMOUNT, Pattern.CASE_INSENSITIVE);
    private static final Pattern LOWER = Pattern.compile(
            "\\b(?:over|above|more than|from|min(?:imum)?|at least)\\s+" + AMOUNT, Pattern.CASE_INSENSITIVE);

    private static final Pattern EURO = Pattern.compile("€|\\beur(?:o|os)?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR = Pattern.compile("\\$|\\busd\\b|\\bdollars?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern POUND = Pattern.compile("£|\\bgbp\\b|\\bpounds?\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<PriceRange> extractPriceRange(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        String currency = detectCurrency(query);

        for (Pattern range : new Pattern[]{BETWEEN, SPAN}) {
            Matcher matcher = range.matcher(query);
            if (matcher.find()) {
                double first = parseAmount(matcher.group(1));
                double second = parseAmount(matcher.group(2));
                return Optional.of(new PriceRange(Math.min(first, second), Math.max(first, second), currency, RANGE_CONFIDENCE));
            }
        }
        Matcher matcher = UPPER.matcher(query);
        if (matcher.find()) {
            return Optional.of(new PriceRange(null, parseAmount(matcher.group(1)), currency, BOUND_CONFIDENCE));
        }
        matcher = LOWER.matcher(query);
        if (matcher.find()) {
            return Optional.of(new PriceRange(parseAmount(matcher.group(1)), null, currency, BOUND_CONFIDENCE));
        }
        return Optional.empty();
    }

    private String detectCurrency(String query) {
        if (DOLLAR.matcher(query).find()) {
            return "USD";
        }
        if (POUND.matcher(query).find()) {
            return "GBP";
        }
        if (EURO.matcher(query).find()) {
            return "EUR";
        }
        return PriceRange.DEFAULT_CURRENCY;
    }

    double parseAmount(String raw) {
        String cleaned = raw.toLowerCase(Locale.ROOT).replaceAll("[€$£\\s]", "");
        if (THOUSANDS.matcher(cleaned.replace("k", "")).matches()) {
            cleaned = cleaned.replace(",", "");
        } else {
            cleaned = cleaned.replace(',', '.');
        }
        double multiplier = 1.0;
        if (cleaned.endsWith("k")) {
            multiplier = 1000.0;
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        return Double.parseDouble(cleaned) * multiplier;
    }
}
