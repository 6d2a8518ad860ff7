package com.furniture.queryparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents the structured, extracted and classified data derived from a search query.
 */
@Schema(description = "Structured attributes parsed from a furniture search query")
public record ParserResult(
        @JsonProperty("product_type") List<String> productType,
        @JsonProperty("features") List<String> features,
        @JsonProperty("price_range") PriceRange priceRange,
        @JsonProperty("location") String location,
        @JsonProperty("classification_summary") Map<String, Object> classificationSummary,
        @JsonProperty("extras") List<String> extras,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("original_query") String originalQuery,
        @JsonProperty("suggested_query") String suggestedQuery
) {
    public ParserResult {
        productType = productType == null ? List.of() : List.copyOf(productType);
        features = features == null ? List.of() : List.copyOf(features);
        classificationSummary = classificationSummary == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(classificationSummary));
        extras = extras == null ? List.of() : List.copyOf(extras);
    }
}
