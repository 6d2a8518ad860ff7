package com.furniture.queryparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Prefix suggestions for product names, brand names and styles.
 */
@Schema(description = "Suggestions for a partially typed query")
public record SuggestionResult(
        @JsonProperty("product_name") List<NamedItem> productName,
        @JsonProperty("brand_name") List<NamedItem> brandName,
        @JsonProperty("styles") List<String> styles
) {
    public SuggestionResult {
        productName = productName == null ? List.of() : productName;
        brandName = brandName == null ? List.of() : brandName;
        styles = styles == null ? List.of() : styles;
    }
}
